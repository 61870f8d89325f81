package com.projectkb.retrieval;

/**
 * One result of a search. {@code score} is the relevance score when {@code reranked}, similarity
 * otherwise; {@code similarityRank} is the position the chunk had before reranking.
 */
public record SearchHit(
        String chunkId,
        String documentId,
        String text,
        SourceAttribution attribution,
        double score,
        double distance,
        int similarityRank,
        boolean reranked,
        boolean truncated) {

    public static SearchHit of(ContextPassage passage) {
        RankedChunk ranked = passage.ranked();
        RetrievedChunk candidate = ranked.candidate();
        return new SearchHit(
                candidate.chunk().id(),
                candidate.chunk().documentId(),
                passage.text(),
                passage.attribution(),
                ranked.score(),
                candidate.distance(),
                candidate.rank(),
                ranked.reranked(),
                passage.truncated());
    }
}
