package com.projectkb.store;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted chunk. {@code sequence} is the store-wide insertion order and breaks distance ties.
 */
public record StoredChunk(
        String id,
        String projectId,
        String documentId,
        int index,
        String text,
        float[] embedding,
        int startOffset,
        int endOffset,
        int overlapLength,
        long sequence,
        Map<String, String> metadata,
        Instant createdAt) {

    public static final String META_FILE_NAME = "fileName";
    public static final String META_CHUNK_SIZE = "chunkSize";
    public static final String META_CHUNK_OVERLAP = "chunkOverlap";
    public static final String META_JOB_ID = "jobId";

    public StoredChunk {
        embedding = embedding == null ? new float[0] : embedding.clone();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** A copy; the stored vector never changes after insertion. */
    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    /** The stored vector itself, for read-only use inside the store. */
    float[] vector() {
        return embedding;
    }

    public String fileName() {
        return metadata.getOrDefault(META_FILE_NAME, "");
    }
}
