package com.projectkb.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.projectkb.ingest.ErrorKind;

/**
 * Immutable snapshot of an ingestion job. Every state change produces a new instance, so a reader
 * always sees the counters and the status of the same moment.
 */
public record IngestionJob(
        String id,
        String projectId,
        String userId,
        JobStatus status,
        int totalFiles,
        int processedFiles,
        int failedFiles,
        List<JobFile> files,
        String errorMessage,
        boolean cancelRequested,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt) {

    public IngestionJob {
        files = files == null ? List.of() : List.copyOf(files);
        if (processedFiles < 0 || failedFiles < 0 || processedFiles + failedFiles > totalFiles) {
            throw new IllegalStateException("Job " + id + " counters out of range: processed=" + processedFiles
                    + " failed=" + failedFiles + " total=" + totalFiles);
        }
        if (status != null && status.isTerminal() && processedFiles + failedFiles != totalFiles) {
            throw new IllegalStateException("Job " + id + " is " + status + " with unattempted files");
        }
    }

    public static IngestionJob create(String id, String projectId, String userId, List<JobFile> files, Instant now) {
        return new IngestionJob(id, projectId, userId, JobStatus.PENDING, files.size(), 0, 0, files, null, false,
                now, now, null, null);
    }

    IngestionJob started(Instant now) {
        return moveTo(JobStatus.PROCESSING, now).withStartedAt(now);
    }

    IngestionJob withSuccess(int fileIndex, String documentId, Instant now) {
        JobFile file = pendingFile(fileIndex);
        return withFile(file.succeeded(documentId, now), processedFiles + 1, failedFiles, now).completeIfDone(now);
    }

    IngestionJob withFailure(int fileIndex, String documentId, ErrorKind kind, String message, Instant now) {
        JobFile file = pendingFile(fileIndex);
        return withFile(file.failed(documentId, kind, message, now), processedFiles, failedFiles + 1, now)
                .completeIfDone(now);
    }

    /** Fails the job, charging every file that was never attempted with {@code kind}. */
    IngestionJob failed(String message, ErrorKind kind, Instant now) {
        if (!status.canMoveTo(JobStatus.FAILED)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to FAILED");
        }
        List<JobFile> updated = new ArrayList<>(files.size());
        int aborted = 0;
        for (JobFile file : files) {
            if (file.awaitingOutcome()) {
                updated.add(file.failed(null, kind, message, now));
                aborted++;
            } else {
                updated.add(file);
            }
        }
        return new IngestionJob(id, projectId, userId, JobStatus.FAILED, totalFiles, processedFiles,
                failedFiles + aborted, updated, message, cancelRequested, createdAt, now, startedAt, now);
    }

    IngestionJob withCancelRequested(Instant now) {
        return new IngestionJob(id, projectId, userId, status, totalFiles, processedFiles, failedFiles, files,
                errorMessage, true, createdAt, now, startedAt, completedAt);
    }

    @JsonIgnore
    public int attemptedFiles() {
        return processedFiles + failedFiles;
    }

    /** Share of files attempted so far, 0-100 with one decimal. */
    @JsonIgnore
    public double progressPercentage() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return round1(attemptedFiles() * 100.0 / totalFiles);
    }

    /** Share of attempted files that succeeded, 0-100 with one decimal. */
    @JsonIgnore
    public double successRate() {
        if (attemptedFiles() == 0) {
            return 0.0;
        }
        return round1(processedFiles * 100.0 / attemptedFiles());
    }

    @JsonIgnore
    public List<FileError> errors() {
        return files.stream()
                .filter(file -> file.state() == FileState.FAILED)
                .map(file -> new FileError(file.index(), file.filename(), file.errorKind(), file.errorMessage()))
                .toList();
    }

    private JobFile pendingFile(int fileIndex) {
        if (status != JobStatus.PROCESSING) {
            throw new IllegalStateException("Job " + id + " is " + status + ", cannot record file outcomes");
        }
        if (fileIndex < 0 || fileIndex >= files.size()) {
            throw new IllegalArgumentException("Job " + id + " has no file " + fileIndex);
        }
        JobFile file = files.get(fileIndex);
        if (!file.awaitingOutcome()) {
            throw new IllegalStateException("File " + fileIndex + " of job " + id + " already recorded as "
                    + file.state());
        }
        return file;
    }

    private IngestionJob withFile(JobFile file, int processed, int failed, Instant now) {
        List<JobFile> updated = new ArrayList<>(files);
        updated.set(file.index(), file);
        return new IngestionJob(id, projectId, userId, status, totalFiles, processed, failed, updated, errorMessage,
                cancelRequested, createdAt, now, startedAt, completedAt);
    }

    private IngestionJob completeIfDone(Instant now) {
        if (attemptedFiles() < totalFiles) {
            return this;
        }
        return moveTo(JobStatus.COMPLETED, now).withCompletedAt(now);
    }

    private IngestionJob moveTo(JobStatus next, Instant now) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        return new IngestionJob(id, projectId, userId, next, totalFiles, processedFiles, failedFiles, files,
                errorMessage, cancelRequested, createdAt, now, startedAt, completedAt);
    }

    private IngestionJob withStartedAt(Instant at) {
        return new IngestionJob(id, projectId, userId, status, totalFiles, processedFiles, failedFiles, files,
                errorMessage, cancelRequested, createdAt, updatedAt, at, completedAt);
    }

    private IngestionJob withCompletedAt(Instant at) {
        return new IngestionJob(id, projectId, userId, status, totalFiles, processedFiles, failedFiles, files,
                errorMessage, cancelRequested, createdAt, updatedAt, startedAt, at);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
