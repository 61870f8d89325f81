package com.projectkb.job;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projectkb.ingest.ErrorKind;

/**
 * Lifecycle and progress of ingestion jobs.
 * <p>
 * A job completes in the same update that records its last file outcome, so a reader never sees
 * every file attempted while the job is still {@code PROCESSING}. {@code FAILED} is reserved for a
 * job that could not go on at all; individual file failures only count towards {@code failedFiles}.
 */
public class JobTracker {
    private static final Logger log = LoggerFactory.getLogger(JobTracker.class);
    private static final Comparator<IngestionJob> NEWEST_FIRST = Comparator
            .comparing(IngestionJob::createdAt).reversed()
            .thenComparing(IngestionJob::id);

    private final JobStore store;
    private final Clock clock;

    public JobTracker(JobStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public IngestionJob createJob(String jobId, String projectId, String userId, List<JobFile> files) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("A job needs at least one file");
        }
        IngestionJob job = IngestionJob.create(jobId, projectId, userId, files, clock.instant());
        store.insert(job);
        log.info("job.created job={} project={} user={} files={}", jobId, projectId, userId, files.size());
        return job;
    }

    public IngestionJob start(String jobId) {
        return store.update(jobId, job -> job.started(clock.instant()));
    }

    public IngestionJob recordSuccess(String jobId, int fileIndex, String documentId) {
        IngestionJob job = store.update(jobId, current -> current.withSuccess(fileIndex, documentId, clock.instant()));
        logIfCompleted(job);
        return job;
    }

    public IngestionJob recordFailure(String jobId, int fileIndex, ErrorKind kind, String message) {
        return recordFailure(jobId, fileIndex, null, kind, message);
    }

    public IngestionJob recordFailure(String jobId, int fileIndex, String documentId, ErrorKind kind,
            String message) {
        IngestionJob job = store.update(jobId,
                current -> current.withFailure(fileIndex, documentId, kind, message, clock.instant()));
        logIfCompleted(job);
        return job;
    }

    /** Fails the whole job; files never attempted are counted as failed with {@link ErrorKind#ABORTED}. */
    public IngestionJob fail(String jobId, String message) {
        IngestionJob job = store.update(jobId, current -> current.failed(message, ErrorKind.ABORTED, clock.instant()));
        log.warn("job.failed job={} processed={} failed={} total={} reason={}", jobId, job.processedFiles(),
                job.failedFiles(), job.totalFiles(), message);
        return job;
    }

    /** Asks a running job to stop scheduling files. Has no effect on a finished job. */
    public IngestionJob requestCancel(String jobId) {
        return store.update(jobId, current -> current.status().isTerminal() || current.cancelRequested()
                ? current
                : current.withCancelRequested(clock.instant()));
    }

    public boolean isCancelRequested(String jobId) {
        return get(jobId).cancelRequested();
    }

    public IngestionJob get(String jobId) {
        return store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<IngestionJob> listByProject(String projectId, int limit) {
        return list(job -> job.projectId().equals(projectId), limit);
    }

    public List<IngestionJob> listByUser(String userId, int limit) {
        return list(job -> job.userId().equals(userId), limit);
    }

    /** Deletes finished jobs completed before {@code cutoff}; returns how many were removed. */
    public int purgeFinishedBefore(Instant cutoff) {
        int purged = 0;
        for (IngestionJob job : store.all()) {
            if (job.status().isTerminal() && job.completedAt() != null && job.completedAt().isBefore(cutoff)
                    && store.delete(job.id())) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("jobs.purged count={} cutoff={}", purged, cutoff);
        }
        return purged;
    }

    /**
     * Fails every job left unfinished by a previous process. Their workers are gone, so nothing else
     * would ever move them to a terminal status.
     */
    public int failInterruptedJobs() {
        int interrupted = 0;
        for (IngestionJob job : store.all()) {
            if (job.status().isTerminal()) {
                continue;
            }
            store.update(job.id(), current -> current.status().isTerminal()
                    ? current
                    : current.failed("Interrupted before completion", ErrorKind.INTERRUPTED, clock.instant()));
            interrupted++;
            log.warn("job.interrupted job={} project={}", job.id(), job.projectId());
        }
        return interrupted;
    }

    private List<IngestionJob> list(Predicate<IngestionJob> filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return store.all().stream()
                .filter(filter)
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    private static void logIfCompleted(IngestionJob job) {
        if (job.status() == JobStatus.COMPLETED) {
            log.info("job.completed job={} processed={} failed={} total={}", job.id(), job.processedFiles(),
                    job.failedFiles(), job.totalFiles());
        }
    }
}
