package com.projectkb.embed;

/**
 * Either a complete vector or the reason there is none; never both.
 */
public record EmbeddingOutcome(float[] vector, EmbeddingException error) {
    public static EmbeddingOutcome success(float[] vector) {
        return new EmbeddingOutcome(vector, null);
    }

    public static EmbeddingOutcome failure(EmbeddingException error) {
        return new EmbeddingOutcome(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
