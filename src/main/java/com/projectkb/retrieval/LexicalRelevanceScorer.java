package com.projectkb.retrieval;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Share of distinct query terms that occur in the passage. Needs no remote service.
 */
public class LexicalRelevanceScorer implements RelevanceScorer {

    @Override
    public double score(String query, String passage) {
        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty() || passage.isBlank()) {
            return 0.0;
        }
        Set<String> words = terms(passage);
        long matches = queryTerms.stream().filter(words::contains).count();
        return (double) matches / queryTerms.size();
    }

    @Override
    public String name() {
        return "lexical";
    }

    private static Set<String> terms(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}
