package com.projectkb.ingest;

/**
 * One passage of a document. {@code text} covers the source range {@code [startOffset, endOffset)};
 * its first {@code overlapLength} characters repeat the tail of the previous chunk.
 */
public record TextChunk(int index, String text, int startOffset, int endOffset, int overlapLength) {

    /** The part of this chunk that no earlier chunk covers. */
    public String core() {
        return text.substring(overlapLength);
    }
}
