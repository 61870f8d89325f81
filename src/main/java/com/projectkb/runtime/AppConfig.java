package com.projectkb.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private ProjectsConfig projects = new ProjectsConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private RerankConfig rerank = new RerankConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private GateConfig gate = new GateConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public ProjectsConfig getProjects() {
        return projects;
    }

    public void setProjects(ProjectsConfig projects) {
        this.projects = projects == null ? new ProjectsConfig() : projects;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public RerankConfig getRerank() {
        return rerank;
    }

    public void setRerank(RerankConfig rerank) {
        this.rerank = rerank == null ? new RerankConfig() : rerank;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public GateConfig getGate() {
        return gate;
    }

    public void setGate(GateConfig gate) {
        this.gate = gate == null ? new GateConfig() : gate;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir = ".projectkb";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }
    }

    /** Projects known to this process. An empty list accepts any non-blank project id. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProjectsConfig {
        private List<String> allowed = new ArrayList<>();

        public List<String> getAllowed() {
            return allowed;
        }

        public void setAllowed(List<String> allowed) {
            this.allowed = allowed == null ? new ArrayList<>() : allowed;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int size = 1000;
        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "hashing";
        private String endpoint = "";
        private String model = "text-embedding-3-small";
        private String apiKeyEnv = "PROJECTKB_EMBEDDING_API_KEY";
        private int dimension = 1536;
        private int maxBatchSize = 64;
        private int maxRetries = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 8000;
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankConfig {
        private boolean enabled = true;
        private String scorer = "lexical";
        private String endpoint = "";
        private String model = "";
        private String apiKeyEnv = "PROJECTKB_RERANK_API_KEY";
        private int timeoutMs = 10000;
        private int batchSize = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getScorer() {
            return scorer;
        }

        public void setScorer(String scorer) {
            this.scorer = scorer;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int candidateK = 50;
        private int finalM = 10;
        private int maxContextChars = 12000;

        public int getCandidateK() {
            return candidateK;
        }

        public void setCandidateK(int candidateK) {
            this.candidateK = candidateK;
        }

        public int getFinalM() {
            return finalM;
        }

        public void setFinalM(int finalM) {
            this.finalM = finalM;
        }

        public int getMaxContextChars() {
            return maxContextChars;
        }

        public void setMaxContextChars(int maxContextChars) {
            this.maxContextChars = maxContextChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int workersPerJob = 4;
        private int maxConcurrentJobs = 2;

        public int getWorkersPerJob() {
            return workersPerJob;
        }

        public void setWorkersPerJob(int workersPerJob) {
            this.workersPerJob = workersPerJob;
        }

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }
    }

    /** Shared permit pool for embedding and rerank calls. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GateConfig {
        private int permits = 8;
        private long acquireTimeoutMs = 30000;

        public int getPermits() {
            return permits;
        }

        public void setPermits(int permits) {
            this.permits = permits;
        }

        public long getAcquireTimeoutMs() {
            return acquireTimeoutMs;
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }
    }
}
