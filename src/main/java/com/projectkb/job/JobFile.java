package com.projectkb.job;

import java.time.Instant;

import com.projectkb.ingest.ErrorKind;

/**
 * Outcome record of one file of a job, kept in upload order.
 */
public record JobFile(
        int index,
        String filename,
        long sizeBytes,
        String declaredType,
        String documentId,
        FileState state,
        ErrorKind errorKind,
        String errorMessage,
        Instant finishedAt) {

    public static JobFile pending(int index, String filename, long sizeBytes, String declaredType) {
        return new JobFile(index, filename, sizeBytes, declaredType, null, FileState.PENDING, null, null, null);
    }

    public JobFile succeeded(String documentId, Instant at) {
        return new JobFile(index, filename, sizeBytes, declaredType, documentId, FileState.SUCCEEDED, null, null, at);
    }

    public JobFile failed(String documentId, ErrorKind kind, String message, Instant at) {
        return new JobFile(index, filename, sizeBytes, declaredType, documentId, FileState.FAILED, kind, message, at);
    }

    public boolean awaitingOutcome() {
        return state == FileState.PENDING;
    }
}
