package com.projectkb.job;

import java.time.Instant;
import java.util.List;

/**
 * What a caller polling a job gets to see.
 */
public record JobStatusView(
        String jobId,
        String projectId,
        JobStatus status,
        int totalFiles,
        int processedFiles,
        int failedFiles,
        List<FileError> errors,
        double progressPercentage,
        double successRate,
        String errorMessage,
        boolean cancelRequested,
        Instant createdAt,
        Instant completedAt) {

    public static JobStatusView of(IngestionJob job) {
        return new JobStatusView(job.id(), job.projectId(), job.status(), job.totalFiles(), job.processedFiles(),
                job.failedFiles(), job.errors(), job.progressPercentage(), job.successRate(), job.errorMessage(),
                job.cancelRequested(), job.createdAt(), job.completedAt());
    }
}
