package com.projectkb;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projectkb.ingest.IngestionFile;
import com.projectkb.ingest.IngestionOrchestrator;
import com.projectkb.job.IngestionJob;
import com.projectkb.job.JobFile;
import com.projectkb.job.JobStatusView;
import com.projectkb.job.JobTracker;
import com.projectkb.retrieval.AssembledContext;
import com.projectkb.retrieval.ContextAssembler;
import com.projectkb.retrieval.RankedChunk;
import com.projectkb.retrieval.Reranker;
import com.projectkb.retrieval.RetrievedChunk;
import com.projectkb.retrieval.Retriever;
import com.projectkb.retrieval.SearchHit;
import com.projectkb.store.Document;
import com.projectkb.store.DocumentNotFoundException;
import com.projectkb.store.VectorStore;

/**
 * Entry point of the knowledge base: ingestion jobs, their status, and search.
 */
public class KnowledgeBaseService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseService.class);

    private final ProjectRegistry projects;
    private final JobTracker jobTracker;
    private final IngestionOrchestrator orchestrator;
    private final VectorStore vectorStore;
    private final Retriever retriever;
    private final Reranker reranker;
    private final ContextAssembler contextAssembler;
    private final int defaultCandidateK;
    private final int defaultFinalM;
    private final Clock clock;

    public KnowledgeBaseService(
            ProjectRegistry projects,
            JobTracker jobTracker,
            IngestionOrchestrator orchestrator,
            VectorStore vectorStore,
            Retriever retriever,
            Reranker reranker,
            ContextAssembler contextAssembler,
            int defaultCandidateK,
            int defaultFinalM,
            Clock clock) {
        this.projects = projects;
        this.jobTracker = jobTracker;
        this.orchestrator = orchestrator;
        this.vectorStore = vectorStore;
        this.retriever = retriever;
        this.reranker = reranker;
        this.contextAssembler = contextAssembler;
        this.defaultCandidateK = defaultCandidateK;
        this.defaultFinalM = defaultFinalM;
        this.clock = clock;
    }

    /**
     * Registers a job for the files and schedules it. Processing is asynchronous; poll
     * {@link #getJobStatus(String)} for progress.
     */
    public String createIngestionJob(String projectId, String userId, List<IngestionFile> files) {
        requireProject(projectId);
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one file is required");
        }
        List<JobFile> records = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            IngestionFile file = files.get(i);
            records.add(JobFile.pending(i, file.filename(), file.size(), file.declaredType()));
        }
        String jobId = UUID.randomUUID().toString();
        IngestionJob job = jobTracker.createJob(jobId, projectId, userId, records);
        orchestrator.submit(job, files);
        return jobId;
    }

    public JobStatusView getJobStatus(String jobId) {
        return JobStatusView.of(jobTracker.get(jobId));
    }

    public JobStatusView cancelJob(String jobId) {
        IngestionJob job = jobTracker.requestCancel(jobId);
        log.info("job.cancel.requested job={} status={}", jobId, job.status());
        return JobStatusView.of(job);
    }

    /** Blocks until the job's run in this process has finished, then returns its status. */
    public JobStatusView awaitJob(String jobId, Duration timeout) throws InterruptedException, TimeoutException {
        jobTracker.get(jobId);
        orchestrator.await(jobId, timeout);
        return getJobStatus(jobId);
    }

    public List<JobStatusView> listJobs(String projectId, int limit) {
        requireProject(projectId);
        return jobTracker.listByProject(projectId, limit).stream().map(JobStatusView::of).toList();
    }

    public List<JobStatusView> listJobsForUser(String userId, int limit) {
        return jobTracker.listByUser(userId, limit).stream().map(JobStatusView::of).toList();
    }

    public int purgeJobsOlderThan(Duration age) {
        return jobTracker.purgeFinishedBefore(clock.instant().minus(age));
    }

    public List<Document> listDocuments(String projectId) {
        requireProject(projectId);
        return vectorStore.listDocuments(projectId);
    }

    public void deleteDocument(String projectId, String documentId) {
        requireProject(projectId);
        if (!vectorStore.deleteDocument(projectId, documentId)) {
            throw new DocumentNotFoundException(projectId, documentId);
        }
    }

    public List<SearchHit> search(String projectId, String query) {
        return search(projectId, query, defaultCandidateK, defaultFinalM);
    }

    /**
     * The best {@code m} passages of the project for {@code query}: {@code k} similarity
     * candidates, reranked, then packed into the context budget.
     */
    public List<SearchHit> search(String projectId, String query, int k, int m) {
        return searchContext(projectId, query, k, m).passages().stream().map(SearchHit::of).toList();
    }

    public AssembledContext searchContext(String projectId, String query, int k, int m) {
        requireProject(projectId);
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        if (k <= 0 || m <= 0 || m > k) {
            throw new IllegalArgumentException("Expected 1 <= m <= k, got k=" + k + " m=" + m);
        }
        List<RetrievedChunk> candidates = retriever.retrieve(projectId, query, k);
        List<RankedChunk> ranked = reranker.rerank(query, candidates, m);
        AssembledContext context = contextAssembler.assemble(ranked);
        log.info("search project={} k={} m={} candidates={} passages={} chars={}", projectId, k, m,
                candidates.size(), context.passages().size(), context.totalChars());
        return context;
    }

    private void requireProject(String projectId) {
        if (!projects.exists(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }
    }

    @Override
    public void close() {
        orchestrator.close();
        reranker.close();
    }
}
