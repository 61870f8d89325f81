package com.projectkb.store;

import java.util.Map;

/**
 * A chunk ready to be stored: text, offsets and embedding, but no identity yet.
 */
public record ChunkDraft(
        int index,
        String text,
        float[] embedding,
        int startOffset,
        int endOffset,
        int overlapLength,
        Map<String, String> metadata) {
    public ChunkDraft {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
