package com.projectkb.store;

import java.time.Instant;

/**
 * One uploaded file of a project. Content type is what extraction resolved, not what was declared.
 */
public record Document(
        String id,
        String projectId,
        String jobId,
        String filename,
        String contentType,
        DocumentStatus status,
        boolean partialExtraction,
        int chunkCount,
        String errorMessage,
        Instant createdAt) {

    public static Document pending(String id, String projectId, String jobId, String filename, String declaredType,
            Instant createdAt) {
        return new Document(id, projectId, jobId, filename, declaredType, DocumentStatus.PENDING, false, 0, null,
                createdAt);
    }

    public Document ready(String resolvedType, boolean partial, int chunks) {
        return new Document(id, projectId, jobId, filename, resolvedType, DocumentStatus.READY, partial, chunks, null,
                createdAt);
    }

    public Document failed(String message) {
        return new Document(id, projectId, jobId, filename, contentType, DocumentStatus.FAILED, false, 0, message,
                createdAt);
    }
}
