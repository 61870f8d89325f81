package com.projectkb.retrieval;

/**
 * A candidate after reranking. {@code relevanceScore} is null when it was not scored, either
 * because reranking fell back to similarity order or because its own scoring call failed.
 */
public record RankedChunk(RetrievedChunk candidate, Double relevanceScore) {

    public static RankedChunk unscored(RetrievedChunk candidate) {
        return new RankedChunk(candidate, null);
    }

    public boolean reranked() {
        return relevanceScore != null;
    }

    /** Relevance score when reranked, similarity otherwise. */
    public double score() {
        return relevanceScore != null ? relevanceScore : candidate.similarity();
    }
}
