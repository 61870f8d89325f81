package com.projectkb.runtime;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projectkb.KnowledgeBaseService;
import com.projectkb.ProjectRegistry;
import com.projectkb.StaticProjectRegistry;
import com.projectkb.embed.Embedder;
import com.projectkb.embed.EmbeddingProvider;
import com.projectkb.embed.EmbeddingProviders;
import com.projectkb.embed.ProviderGate;
import com.projectkb.extract.ExtractionService;
import com.projectkb.ingest.Chunker;
import com.projectkb.ingest.IngestionOrchestrator;
import com.projectkb.job.JobTracker;
import com.projectkb.job.LocalJsonJobStore;
import com.projectkb.retrieval.ContextAssembler;
import com.projectkb.retrieval.GeminiRelevanceScorer;
import com.projectkb.retrieval.HttpRelevanceScorer;
import com.projectkb.retrieval.LexicalRelevanceScorer;
import com.projectkb.retrieval.RelevanceScorer;
import com.projectkb.retrieval.Reranker;
import com.projectkb.retrieval.Retriever;
import com.projectkb.store.LocalJsonVectorStore;

import okhttp3.OkHttpClient;

/**
 * Wires a {@link KnowledgeBaseService} from configuration and environment variables.
 */
public final class ServiceFactory {
    private static final Logger log = LoggerFactory.getLogger(ServiceFactory.class);

    private ServiceFactory() {
    }

    public static KnowledgeBaseService create(AppConfig config, Map<String, String> environment) {
        return create(config, environment, Clock.systemUTC());
    }

    public static KnowledgeBaseService create(AppConfig config, Map<String, String> environment, Clock clock) {
        Path dataDir = Path.of(config.getStorage().getDataDir());
        ProviderGate gate = new ProviderGate(config.getGate().getPermits(), config.getGate().getAcquireTimeoutMs());

        AppConfig.EmbeddingConfig embeddingConfig = config.getEmbedding();
        OkHttpClient embeddingClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(embeddingConfig.getTimeoutMs()))
                .build();
        EmbeddingProvider provider = EmbeddingProviders.fromConfig(embeddingConfig, embeddingClient, environment);
        Embedder embedder = new Embedder(provider, gate, embeddingConfig.getMaxBatchSize(),
                embeddingConfig.getMaxRetries(), embeddingConfig.getInitialBackoffMs(),
                embeddingConfig.getMaxBackoffMs());

        LocalJsonVectorStore vectorStore = new LocalJsonVectorStore(dataDir, provider.dimension(), clock);
        JobTracker jobTracker = new JobTracker(new LocalJsonJobStore(dataDir), clock);
        int interrupted = jobTracker.failInterruptedJobs();
        if (interrupted > 0) {
            log.warn("startup.jobs.interrupted count={}", interrupted);
        }

        Chunker chunker = new Chunker(config.getChunking().getSize(), config.getChunking().getOverlap());
        IngestionOrchestrator orchestrator = new IngestionOrchestrator(
                new ExtractionService(),
                chunker,
                embedder,
                vectorStore,
                jobTracker,
                clock,
                config.getIngestion().getWorkersPerJob(),
                config.getIngestion().getMaxConcurrentJobs());

        AppConfig.RerankConfig rerankConfig = config.getRerank();
        ExecutorService rerankExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "rerank");
            thread.setDaemon(true);
            return thread;
        });
        Reranker reranker = new Reranker(scorer(rerankConfig, environment), gate, rerankConfig.getTimeoutMs(),
                rerankExecutor);

        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        log.info("service.ready dataDir={} embedding={} dimension={} rerank={} chunkSize={} overlap={}",
                dataDir.toAbsolutePath().normalize(), provider.name(), provider.dimension(),
                reranker.enabled() ? rerankConfig.getScorer() : "disabled", chunker.chunkSize(), chunker.overlap());
        return new KnowledgeBaseService(
                projectRegistry(config.getProjects()),
                jobTracker,
                orchestrator,
                vectorStore,
                new Retriever(embedder, vectorStore),
                reranker,
                new ContextAssembler(retrieval.getMaxContextChars()),
                retrieval.getCandidateK(),
                retrieval.getFinalM(),
                clock);
    }

    static RelevanceScorer scorer(AppConfig.RerankConfig config, Map<String, String> environment) {
        if (!config.isEnabled()) {
            return null;
        }
        String scorer = config.getScorer() == null ? "lexical" : config.getScorer().toLowerCase(Locale.ROOT);
        return switch (scorer) {
            case "lexical" -> new LexicalRelevanceScorer();
            case "http" -> new HttpRelevanceScorer(
                    new OkHttpClient.Builder().callTimeout(Duration.ofMillis(config.getTimeoutMs())).build(),
                    config.getEndpoint(),
                    config.getModel(),
                    config.getApiKeyEnv() == null ? null : environment.get(config.getApiKeyEnv()));
            case "gemini" -> new GeminiRelevanceScorer(
                    new OkHttpClient.Builder().callTimeout(Duration.ofMillis(config.getTimeoutMs())).build(),
                    config.getEndpoint() == null || config.getEndpoint().isBlank()
                            ? "https://generativelanguage.googleapis.com/v1beta"
                            : config.getEndpoint(),
                    config.getModel() == null || config.getModel().isBlank() ? "gemini-1.5-flash" : config.getModel(),
                    config.getApiKeyEnv() == null ? null : environment.get(config.getApiKeyEnv()),
                    config.getBatchSize());
            default -> throw new IllegalArgumentException("Unknown rerank scorer: " + config.getScorer());
        };
    }

    static ProjectRegistry projectRegistry(AppConfig.ProjectsConfig config) {
        if (config.getAllowed().isEmpty()) {
            return ProjectRegistry.anyProject();
        }
        return new StaticProjectRegistry(new HashSet<>(config.getAllowed()));
    }
}
