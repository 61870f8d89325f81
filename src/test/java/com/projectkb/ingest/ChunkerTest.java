package com.projectkb.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ChunkerTest {

    @Test
    void shouldSplitLettersWithSingleCharacterOverlap() {
        List<TextChunk> chunks = new Chunker(4, 1).chunk("ABCDEFGHIJ");

        assertEquals(List.of("ABCD", "DEFG", "GHIJ"), chunks.stream().map(TextChunk::text).toList());
        assertEquals(List.of(0, 1, 2), chunks.stream().map(TextChunk::index).toList());
        assertEquals(List.of(0, 1, 1), chunks.stream().map(TextChunk::overlapLength).toList());
    }

    @Test
    void shouldReturnNoChunksForEmptyText() {
        assertTrue(new Chunker(10, 2).chunk("").isEmpty());
    }

    @Test
    void shouldReturnSingleChunkWithoutOverlapForShortText() {
        List<TextChunk> chunks = new Chunker(100, 20).chunk("A short note.");

        assertEquals(1, chunks.size());
        assertEquals("A short note.", chunks.get(0).text());
        assertEquals(0, chunks.get(0).overlapLength());
        assertEquals(0, chunks.get(0).startOffset());
        assertEquals(13, chunks.get(0).endOffset());
    }

    @Test
    void shouldBeDeterministic() {
        String text = sampleText();
        Chunker chunker = new Chunker(120, 30);

        assertEquals(chunker.chunk(text), chunker.chunk(text));
    }

    @Test
    void shouldReconstructTextAndRespectSizeLimit() {
        String text = sampleText();
        for (int[] params : new int[][] { { 120, 30 }, { 64, 0 }, { 50, 49 }, { 7, 3 } }) {
            Chunker chunker = new Chunker(params[0], params[1]);
            List<TextChunk> chunks = chunker.chunk(text);

            StringBuilder rebuilt = new StringBuilder();
            for (int i = 0; i < chunks.size(); i++) {
                TextChunk chunk = chunks.get(i);
                assertEquals(i, chunk.index());
                assertTrue(chunk.text().length() <= params[0], "chunk longer than limit: " + chunk);
                assertEquals(text.substring(chunk.startOffset(), chunk.endOffset()), chunk.text());
                rebuilt.append(chunk.core());
            }
            assertEquals(text, rebuilt.toString());
        }
    }

    @Test
    void shouldPreferParagraphBoundaries() {
        String first = "First paragraph talks about ingestion.";
        String second = "Second paragraph talks about search.";
        List<TextChunk> chunks = new Chunker(50, 0).chunk(first + "\n\n" + second);

        assertEquals(2, chunks.size());
        assertEquals(first + "\n\n", chunks.get(0).text());
        assertEquals(second, chunks.get(1).text());
    }

    @Test
    void shouldPrefixTailOfPreviousChunk() {
        List<TextChunk> chunks = new Chunker(40, 10).chunk(sampleText());

        for (int i = 1; i < chunks.size(); i++) {
            TextChunk previous = chunks.get(i - 1);
            TextChunk current = chunks.get(i);
            String overlap = current.text().substring(0, current.overlapLength());
            assertTrue(previous.text().endsWith(overlap));
            assertEquals(previous.endOffset(), current.startOffset() + current.overlapLength());
        }
    }

    @Test
    void shouldRejectInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new Chunker(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(10, 10));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(10, -1));
    }

    private static String sampleText() {
        return """
                Project knowledge bases hold uploaded documents. Each document is split into chunks!

                Chunks are embedded and stored per project. Searches never cross project boundaries? \
                They do not.

                A verylongwordwithoutanybreaksthatmustbecutatcharacterlevelbecauseitexceedseverylimit ends here.
                """;
    }
}
