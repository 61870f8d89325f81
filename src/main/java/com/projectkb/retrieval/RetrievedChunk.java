package com.projectkb.retrieval;

import com.projectkb.store.StoredChunk;

/**
 * A similarity-search candidate. {@code rank} is its 0-based position in similarity order.
 */
public record RetrievedChunk(StoredChunk chunk, double distance, int rank) {
    public double similarity() {
        return 1.0 - distance;
    }
}
