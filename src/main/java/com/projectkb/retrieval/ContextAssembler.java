package com.projectkb.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs ranked chunks into a character budget, best first. Stops at the first chunk that does not
 * fit and never reorders. A top chunk that alone exceeds the budget is cut at a word boundary.
 */
public class ContextAssembler {
    private final int maxChars;

    public ContextAssembler(int maxChars) {
        this.maxChars = requirePositive(maxChars);
    }

    public AssembledContext assemble(List<RankedChunk> ranked) {
        return assemble(ranked, maxChars);
    }

    public AssembledContext assemble(List<RankedChunk> ranked, int budget) {
        requirePositive(budget);
        List<ContextPassage> passages = new ArrayList<>();
        int total = 0;
        for (RankedChunk chunk : ranked) {
            String text = chunk.candidate().chunk().text();
            SourceAttribution attribution = SourceAttribution.of(chunk.candidate().chunk());
            if (total + text.length() <= budget) {
                passages.add(new ContextPassage(chunk, text, attribution, false));
                total += text.length();
                continue;
            }
            if (passages.isEmpty()) {
                String cut = truncate(text, budget);
                passages.add(new ContextPassage(chunk, cut, attribution, true));
                total = cut.length();
            }
            break;
        }
        return new AssembledContext(passages, total);
    }

    static String truncate(String text, int budget) {
        String head = text.substring(0, budget);
        int start = 0;
        while (start < head.length() && Character.isWhitespace(head.charAt(start))) {
            start++;
        }
        if (start == head.length()) {
            String rest = text.strip();
            return rest.substring(0, Math.min(budget, rest.length()));
        }
        if (Character.isWhitespace(text.charAt(budget))) {
            return head.substring(start).stripTrailing();
        }
        // leading whitespace is not a word boundary
        for (int i = head.length() - 1; i > start; i--) {
            if (Character.isWhitespace(head.charAt(i))) {
                return head.substring(start, i).stripTrailing();
            }
        }
        return head.substring(start);
    }

    private static int requirePositive(int budget) {
        if (budget <= 0) {
            throw new IllegalArgumentException("context budget must be > 0");
        }
        return budget;
    }
}
