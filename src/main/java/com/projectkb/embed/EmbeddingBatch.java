package com.projectkb.embed;

import java.util.List;

public record EmbeddingBatch(List<EmbeddingOutcome> outcomes) {
    public EmbeddingBatch {
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(EmbeddingOutcome::succeeded);
    }

    public List<EmbeddingException> failures() {
        return outcomes.stream()
                .filter(outcome -> !outcome.succeeded())
                .map(EmbeddingOutcome::error)
                .toList();
    }

    /** Vectors in input order; only meaningful when {@link #allSucceeded()}. */
    public List<float[]> vectors() {
        return outcomes.stream().map(EmbeddingOutcome::vector).toList();
    }
}
