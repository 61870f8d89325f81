package com.projectkb;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.projectkb.ingest.IngestionFile;
import com.projectkb.job.FileError;
import com.projectkb.job.JobStatusView;
import com.projectkb.retrieval.SearchHit;
import com.projectkb.runtime.AppConfig;
import com.projectkb.runtime.ServiceFactory;
import com.projectkb.store.Document;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "project-kb",
        mixinStandardHelpOptions = true,
        version = "project-kb 0.1.0",
        description = "Ingest documents into per-project knowledge bases and search them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = { "-p", "--project" }, description = "Project id")
    String projectId;

    @Option(names = "--user", description = "Id of the user starting an ingestion job", defaultValue = "cli")
    String userId;

    @Option(names = { "-f", "--file" }, description = "File to ingest; repeat for several files")
    List<Path> files = new ArrayList<>();

    @Option(names = "--job-id", description = "Ingestion job id for status mode")
    String jobId;

    @Option(names = "--document-id", description = "Document id for delete-document mode")
    String documentId;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Similarity candidates to retrieve (default from config)")
    Integer topK;

    @Option(names = "--top-m", description = "Results to keep after reranking (default from config)")
    Integer topM;

    @Option(names = "--wait-seconds", description = "In ingest mode, wait up to this long for the job to finish", defaultValue = "0")
    long waitSeconds;

    @Option(names = "--older-than-days", description = "Age of finished jobs removed by purge-jobs", defaultValue = "30")
    long olderThanDays;

    @Option(names = "--limit", description = "Maximum jobs listed", defaultValue = "20")
    int limit;

    enum Mode {
        ingest,
        status,
        jobs,
        search,
        documents,
        delete_document,
        purge_jobs
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(Main main) {
        return new CommandLine(main)
                .registerConverter(Mode.class, value -> Mode.valueOf(value.replace('-', '_')));
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting project-kb in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (KnowledgeBaseService service = ServiceFactory.create(config, System.getenv())) {
            return switch (mode) {
                case ingest -> ingest(service);
                case status -> status(service);
                case jobs -> jobs(service);
                case search -> search(service, config);
                case documents -> documents(service);
                case delete_document -> deleteDocument(service);
                case purge_jobs -> purgeJobs(service);
            };
        }
    }

    private int ingest(KnowledgeBaseService service) throws IOException, InterruptedException {
        if (projectId == null || files.isEmpty()) {
            log.error("--project and at least one --file are required in ingest mode");
            return 2;
        }
        List<IngestionFile> uploads = new ArrayList<>();
        for (Path file : files) {
            uploads.add(new IngestionFile(file.getFileName().toString(), Files.readAllBytes(file),
                    Files.probeContentType(file)));
        }
        String createdJobId = service.createIngestionJob(projectId, userId, uploads);
        log.info("Created ingestion job id={} project={} files={}", createdJobId, projectId, uploads.size());
        if (waitSeconds > 0) {
            try {
                logStatus(service.awaitJob(createdJobId, Duration.ofSeconds(waitSeconds)));
            } catch (TimeoutException e) {
                log.warn("Job {} still running after {}s; poll it with --mode status", createdJobId, waitSeconds);
                logStatus(service.getJobStatus(createdJobId));
            }
        }
        return 0;
    }

    private int status(KnowledgeBaseService service) {
        if (jobId == null) {
            log.error("--job-id is required in status mode");
            return 2;
        }
        logStatus(service.getJobStatus(jobId));
        return 0;
    }

    private int jobs(KnowledgeBaseService service) {
        if (projectId == null) {
            log.error("--project is required in jobs mode");
            return 2;
        }
        service.listJobs(projectId, limit).forEach(this::logStatus);
        return 0;
    }

    private int search(KnowledgeBaseService service, AppConfig config) {
        if (projectId == null || query == null || query.isBlank()) {
            log.error("--project and --query are required in search mode");
            return 2;
        }
        int k = topK != null ? topK : config.getRetrieval().getCandidateK();
        int m = topM != null ? topM : Math.min(k, config.getRetrieval().getFinalM());
        List<SearchHit> hits = service.search(projectId, query, k, m);
        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            log.info("Result #{} score={} distance={} similarityRank={} reranked={} source={} text={}",
                    i + 1,
                    String.format("%.4f", hit.score()),
                    String.format("%.4f", hit.distance()),
                    hit.similarityRank(),
                    hit.reranked(),
                    hit.attribution().label(),
                    snippet(hit.text()));
        }
        if (hits.isEmpty()) {
            log.info("No results for project={}", projectId);
        }
        return 0;
    }

    private int documents(KnowledgeBaseService service) {
        if (projectId == null) {
            log.error("--project is required in documents mode");
            return 2;
        }
        for (Document document : service.listDocuments(projectId)) {
            log.info("Document id={} file={} type={} status={} chunks={} partial={} job={}",
                    document.id(),
                    document.filename(),
                    document.contentType(),
                    document.status(),
                    document.chunkCount(),
                    document.partialExtraction(),
                    document.jobId());
        }
        return 0;
    }

    private int deleteDocument(KnowledgeBaseService service) {
        if (projectId == null || documentId == null) {
            log.error("--project and --document-id are required in delete-document mode");
            return 2;
        }
        service.deleteDocument(projectId, documentId);
        log.info("Deleted document id={} project={}", documentId, projectId);
        return 0;
    }

    private int purgeJobs(KnowledgeBaseService service) {
        int purged = service.purgeJobsOlderThan(Duration.ofDays(olderThanDays));
        log.info("Purged {} finished jobs older than {} days", purged, olderThanDays);
        return 0;
    }

    private void logStatus(JobStatusView status) {
        log.info("Job id={} project={} status={} total={} processed={} failed={} progress={}% successRate={}%",
                status.jobId(),
                status.projectId(),
                status.status(),
                status.totalFiles(),
                status.processedFiles(),
                status.failedFiles(),
                status.progressPercentage(),
                status.successRate());
        for (FileError error : status.errors()) {
            log.info("  file #{} {} kind={} reason={}", error.index(), error.filename(), error.kind(), error.message());
        }
    }

    private static String snippet(String text) {
        String trimmed = text.strip().replaceAll("\\s+", " ");
        return trimmed.length() > 240 ? trimmed.substring(0, 240) + "..." : trimmed;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
