package com.projectkb.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into ordered, overlapping chunks of at most {@code chunkSize} characters.
 * <p>
 * The text is cut recursively on the coarsest separator whose pieces fit (paragraph break, then
 * sentence break, then whitespace, then single characters). Separators stay with the piece before
 * them, so no character is lost. Pieces are then packed greedily: the first chunk may hold
 * {@code chunkSize} characters, every later chunk {@code chunkSize - overlap} characters, to which
 * the last {@code overlap} characters of the previous chunk's source range are prefixed.
 * Output depends only on the text and the two parameters.
 */
public class Chunker {
    private static final List<Pattern> SEPARATORS = List.of(
            Pattern.compile("\\n[ \\t]*\\n\\s*"),
            Pattern.compile("(?<=[.!?])\\s+"),
            Pattern.compile("\\s+"));

    private final int chunkSize;
    private final int overlap;

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be >= 0 and < chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    public List<TextChunk> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Integer> pieceEnds = new ArrayList<>();
        split(text, 0, text.length(), 0, pieceEnds);

        List<TextChunk> chunks = new ArrayList<>();
        int coreStart = 0;
        int coreEnd = 0;
        int previousSpanStart = 0;
        for (int pieceEnd : pieceEnds) {
            int budget = chunks.isEmpty() ? chunkSize : chunkSize - overlap;
            if (pieceEnd - coreStart <= budget) {
                coreEnd = pieceEnd;
                continue;
            }
            TextChunk chunk = build(text, chunks.size(), coreStart, coreEnd, previousSpanStart);
            chunks.add(chunk);
            previousSpanStart = chunk.startOffset();
            coreStart = coreEnd;
            coreEnd = pieceEnd;
        }
        chunks.add(build(text, chunks.size(), coreStart, coreEnd, previousSpanStart));
        return List.copyOf(chunks);
    }

    private void split(String text, int start, int end, int level, List<Integer> pieceEnds) {
        if (end - start <= chunkSize - overlap) {
            pieceEnds.add(end);
            return;
        }
        if (level == SEPARATORS.size()) {
            for (int i = start + 1; i <= end; i++) {
                pieceEnds.add(i);
            }
            return;
        }
        Matcher matcher = SEPARATORS.get(level).matcher(text);
        matcher.region(start, end);
        matcher.useTransparentBounds(true);
        int pieceStart = start;
        while (matcher.find()) {
            int cut = matcher.end();
            if (cut >= end) {
                break;
            }
            split(text, pieceStart, cut, level + 1, pieceEnds);
            pieceStart = cut;
        }
        split(text, pieceStart, end, level + 1, pieceEnds);
    }

    private TextChunk build(String text, int index, int coreStart, int coreEnd, int previousSpanStart) {
        int overlapLength = index == 0 ? 0 : Math.min(overlap, coreStart - previousSpanStart);
        int spanStart = coreStart - overlapLength;
        return new TextChunk(index, text.substring(spanStart, coreEnd), spanStart, coreEnd, overlapLength);
    }
}
