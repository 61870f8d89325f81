package com.projectkb.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how well one passage answers a query. Higher is more relevant; scales are scorer-specific
 * and only compared within one query.
 */
public interface RelevanceScorer {
    double score(String query, String passage) throws RelevanceScoringException;

    /** Largest number of passages one {@link #scoreBatch} call accepts. */
    default int maxBatchSize() {
        return 1;
    }

    /** Scores index-aligned with {@code passages}. */
    default List<Double> scoreBatch(String query, List<String> passages) throws RelevanceScoringException {
        List<Double> scores = new ArrayList<>(passages.size());
        for (String passage : passages) {
            scores.add(score(query, passage));
        }
        return scores;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
