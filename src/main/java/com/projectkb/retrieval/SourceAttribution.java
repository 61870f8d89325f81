package com.projectkb.retrieval;

import com.projectkb.store.StoredChunk;

/**
 * Where a passage came from: the document, its file name and the chunk's character range.
 */
public record SourceAttribution(String documentId, String fileName, int chunkIndex, int startOffset,
        int endOffset) {

    public static SourceAttribution of(StoredChunk chunk) {
        return new SourceAttribution(chunk.documentId(), chunk.fileName(), chunk.index(), chunk.startOffset(),
                chunk.endOffset());
    }

    public String label() {
        return "%s#%d:%d-%d".formatted(fileName, chunkIndex, startOffset, endOffset);
    }
}
