package com.projectkb.ingest;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projectkb.embed.Embedder;
import com.projectkb.embed.EmbeddingBatch;
import com.projectkb.embed.EmbeddingException;
import com.projectkb.extract.ExtractionResult;
import com.projectkb.extract.ExtractionService;
import com.projectkb.job.IngestionJob;
import com.projectkb.job.JobTracker;
import com.projectkb.store.ChunkDraft;
import com.projectkb.store.Document;
import com.projectkb.store.StorageException;
import com.projectkb.store.StoredChunk;
import com.projectkb.store.VectorStore;

/**
 * Runs ingestion jobs: every file goes through extract, chunk, embed and store, and its outcome is
 * recorded on the job.
 * <p>
 * Jobs share a bounded pool; the files of one job run on a fixed pool of their own. A file failure
 * only fails that file. A {@link StorageException} stops the job from scheduling further files and,
 * once in-flight files have finished, fails the job.
 */
public class IngestionOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);
    private static final long WORKER_SHUTDOWN_SECONDS = 30;

    private final ExtractionService extractionService;
    private final Chunker chunker;
    private final Embedder embedder;
    private final VectorStore vectorStore;
    private final JobTracker jobTracker;
    private final Clock clock;
    private final int workersPerJob;
    private final ExecutorService jobExecutor;
    private final Map<String, Future<?>> running = new ConcurrentHashMap<>();

    public IngestionOrchestrator(
            ExtractionService extractionService,
            Chunker chunker,
            Embedder embedder,
            VectorStore vectorStore,
            JobTracker jobTracker,
            Clock clock,
            int workersPerJob,
            int maxConcurrentJobs) {
        if (workersPerJob <= 0 || maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("workersPerJob and maxConcurrentJobs must be > 0");
        }
        this.extractionService = extractionService;
        this.chunker = chunker;
        this.embedder = embedder;
        this.vectorStore = vectorStore;
        this.jobTracker = jobTracker;
        this.clock = clock;
        this.workersPerJob = workersPerJob;
        this.jobExecutor = Executors.newFixedThreadPool(maxConcurrentJobs, named("ingest-job"));
    }

    /** Schedules a created job; returns immediately. */
    public Future<?> submit(IngestionJob job, List<IngestionFile> files) {
        if (files.size() != job.totalFiles()) {
            throw new IllegalArgumentException("Job " + job.id() + " expects " + job.totalFiles() + " files, got "
                    + files.size());
        }
        List<IngestionFile> snapshot = List.copyOf(files);
        FutureTask<Void> task = new FutureTask<>(() -> run(job.id(), job.projectId(), snapshot), null);
        running.put(job.id(), task);
        jobExecutor.execute(task);
        return task;
    }

    /**
     * Waits until the job's run has finished. Returns at once when the job is not running in this
     * process.
     */
    public void await(String jobId, Duration timeout) throws InterruptedException, TimeoutException {
        Future<?> future = running.get(jobId);
        if (future == null) {
            return;
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Ingestion run of job " + jobId + " crashed", e.getCause());
        }
    }

    void run(String jobId, String projectId, List<IngestionFile> files) {
        try {
            jobTracker.start(jobId);
            log.info("ingest.job.started job={} project={} files={}", jobId, projectId, files.size());
            JobRun run = new JobRun(jobId, projectId);
            boolean interrupted = processAll(run, files);
            try {
                finish(run);
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        } catch (StorageException e) {
            log.error("ingest.job.unrecorded job={} reason={}", jobId, e.getMessage(), e);
        } finally {
            running.remove(jobId);
        }
    }

    /**
     * Runs every file slot and waits for the workers. Returns whether this thread was interrupted;
     * the flag stays cleared until the job is finished so in-flight files can complete.
     */
    private boolean processAll(JobRun run, List<IngestionFile> files) {
        ExecutorService workers = Executors.newFixedThreadPool(
                Math.min(workersPerJob, files.size()), named("ingest-" + run.jobId));
        List<Future<?>> slots = new ArrayList<>(files.size());
        boolean interrupted = false;
        try {
            for (int i = 0; i < files.size(); i++) {
                int index = i;
                IngestionFile file = files.get(i);
                slots.add(workers.submit(() -> processSlot(run, index, file)));
            }
            for (Future<?> slot : slots) {
                try {
                    slot.get();
                } catch (ExecutionException e) {
                    run.abortWith("Worker crashed: " + e.getCause());
                    log.error("ingest.worker.crashed job={}", run.jobId, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            run.abortWith("Ingestion interrupted");
            log.warn("ingest.job.interrupted job={}", run.jobId);
        } finally {
            interrupted |= shutdown(workers);
        }
        return interrupted;
    }

    private void finish(JobRun run) {
        IngestionJob job = jobTracker.get(run.jobId);
        if (job.status().isTerminal()) {
            return;
        }
        String reason = run.abortReason.get();
        jobTracker.fail(run.jobId, reason != null ? reason : "Ingestion ended with unattempted files");
    }

    private void processSlot(JobRun run, int index, IngestionFile file) {
        if (run.abortReason.get() != null) {
            return;
        }
        if (jobTracker.isCancelRequested(run.jobId)) {
            recordFailure(run, index, null, ErrorKind.CANCELLED, "Job cancelled before this file was processed");
            return;
        }
        processFile(run, index, file);
    }

    private void processFile(JobRun run, int index, IngestionFile file) {
        String documentId = UUID.randomUUID().toString();
        try {
            vectorStore.registerDocument(Document.pending(documentId, run.projectId, run.jobId, file.filename(),
                    file.declaredType(), clock.instant()));
        } catch (StorageException e) {
            storageFailed(run, index, null, e);
            return;
        }

        try {
            Document document = ingest(run, documentId, file);
            jobTracker.recordSuccess(run.jobId, index, documentId);
            log.info("ingest.file.done job={} file={} document={} chunks={} partial={}", run.jobId, file.filename(),
                    documentId, document.chunkCount(), document.partialExtraction());
        } catch (IngestionException e) {
            log.warn("ingest.file.failed job={} file={} kind={} reason={}", run.jobId, file.filename(), e.kind(),
                    e.getMessage());
            recordFailure(run, index, documentId, e.kind(), e.getMessage());
        } catch (StorageException e) {
            storageFailed(run, index, documentId, e);
        } catch (RuntimeException e) {
            log.error("ingest.file.failed job={} file={} kind={}", run.jobId, file.filename(), ErrorKind.INTERNAL, e);
            recordFailure(run, index, documentId, ErrorKind.INTERNAL, "Internal error: " + e.getMessage());
        }
    }

    private Document ingest(JobRun run, String documentId, IngestionFile file) throws IngestionException {
        ExtractionResult extraction = extractionService.extract(file.filename(), file.content(), file.declaredType());
        List<TextChunk> chunks = chunker.chunk(extraction.text());
        EmbeddingBatch embeddings = embedder.embed(chunks.stream().map(TextChunk::text).toList());
        if (!embeddings.allSucceeded()) {
            List<EmbeddingException> failures = embeddings.failures();
            EmbeddingException first = failures.get(0);
            throw new EmbeddingException(first.inputIndex(), failures.size() + " of " + chunks.size()
                    + " chunks could not be embedded: " + first.getMessage(), first);
        }

        Map<String, String> metadata = new HashMap<>();
        metadata.put(StoredChunk.META_FILE_NAME, file.filename());
        metadata.put(StoredChunk.META_CHUNK_SIZE, Integer.toString(chunker.chunkSize()));
        metadata.put(StoredChunk.META_CHUNK_OVERLAP, Integer.toString(chunker.overlap()));
        metadata.put(StoredChunk.META_JOB_ID, run.jobId);

        List<float[]> vectors = embeddings.vectors();
        List<ChunkDraft> drafts = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            drafts.add(new ChunkDraft(chunk.index(), chunk.text(), vectors.get(chunk.index()), chunk.startOffset(),
                    chunk.endOffset(), chunk.overlapLength(), metadata));
        }
        return vectorStore.appendChunks(run.projectId, documentId, extraction.format().mediaType(),
                extraction.partial(), drafts);
    }

    private void recordFailure(JobRun run, int index, String documentId, ErrorKind kind, String message) {
        try {
            if (documentId != null) {
                vectorStore.markFailed(run.projectId, documentId, message);
            }
            jobTracker.recordFailure(run.jobId, index, documentId, kind, message);
        } catch (StorageException e) {
            storageFailed(run, index, documentId, e);
        }
    }

    private void storageFailed(JobRun run, int index, String documentId, StorageException failure) {
        run.abortWith("Storage unavailable: " + failure.getMessage());
        log.error("ingest.storage.failed job={} fileIndex={} reason={}", run.jobId, index, failure.getMessage(),
                failure);
        try {
            jobTracker.recordFailure(run.jobId, index, documentId, ErrorKind.STORAGE, failure.getMessage());
        } catch (StorageException e) {
            log.error("ingest.outcome.unrecorded job={} fileIndex={} reason={}", run.jobId, index, e.getMessage());
        }
    }

    /** Waits a bounded time for in-flight files; returns whether the wait was interrupted. */
    private static boolean shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            return false;
        } catch (InterruptedException e) {
            workers.shutdownNow();
            return true;
        }
    }

    @Override
    public void close() {
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class JobRun {
        private final String jobId;
        private final String projectId;
        private final AtomicReference<String> abortReason = new AtomicReference<>();

        private JobRun(String jobId, String projectId) {
            this.jobId = jobId;
            this.projectId = projectId;
        }

        private void abortWith(String reason) {
            abortReason.compareAndSet(null, reason);
        }
    }
}
