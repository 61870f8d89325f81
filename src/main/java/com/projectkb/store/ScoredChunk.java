package com.projectkb.store;

public record ScoredChunk(StoredChunk chunk, double distance) {
    public double similarity() {
        return 1.0 - distance;
    }
}
