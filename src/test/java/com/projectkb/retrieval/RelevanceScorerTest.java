package com.projectkb.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okio.Buffer;

class RelevanceScorerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final GeminiRelevanceScorer gemini = new GeminiRelevanceScorer(new OkHttpClient(),
            "https://generativelanguage.googleapis.com/v1beta/", "gemini-1.5-flash", "key", 20);

    @Test
    void shouldScoreShareOfQueryTermsFound() {
        LexicalRelevanceScorer scorer = new LexicalRelevanceScorer();

        assertEquals(1.0, scorer.score("Vector Store", "the vector store keeps chunks"));
        assertEquals(0.5, scorer.score("vector cache", "the vector store keeps chunks"));
        assertEquals(0.0, scorer.score("vector", "   "));
        assertEquals(0.0, scorer.score("!!!", "anything"));
    }

    @Test
    void shouldParseNumericScore() throws Exception {
        assertEquals(0.75, HttpRelevanceScorer.parseScore(mapper.readTree("{\"score\": 0.75}")));
        assertThrows(RelevanceScoringException.class,
                () -> HttpRelevanceScorer.parseScore(mapper.readTree("{\"score\": \"high\"}")));
        assertThrows(RelevanceScoringException.class, () -> HttpRelevanceScorer.parseScore(mapper.readTree("{}")));
    }

    @Test
    void shouldReadGeminiScoreArrayInPassageOrder() throws Exception {
        assertEquals(List.of(8.0, 3.0, 9.5), gemini.parseScores(answer("[8, 3, 9.5]"), 3));
        assertEquals(List.of(1.0, 0.0), gemini.parseScores(answer("```json\n[1, 0]\n```"), 2));
    }

    @Test
    void shouldRejectGeminiAnswerWithWrongScoreCount() throws Exception {
        RelevanceScoringException error = assertThrows(RelevanceScoringException.class,
                () -> gemini.parseScores(answer("[8, 3]"), 3));

        assertTrue(error.getMessage().contains("2 scores for 3 passages"));
        assertThrows(RelevanceScoringException.class, () -> gemini.parseScores(answer("very relevant"), 1));
        assertThrows(RelevanceScoringException.class, () -> gemini.parseScores(answer("[8, \"high\"]"), 2));
        assertThrows(RelevanceScoringException.class, () -> gemini.parseScores(mapper.readTree("{}"), 1));
    }

    @Test
    void shouldBuildGeminiJudgeRequest() throws Exception {
        Request request = gemini.buildRequest("when are backups taken", List.of("Backups run nightly.", "x".repeat(900)));

        assertEquals("key", request.header("x-goog-api-key"));
        assertTrue(request.url().toString().endsWith("/models/gemini-1.5-flash:generateContent"));
        Buffer body = new Buffer();
        request.body().writeTo(body);
        JsonNode payload = mapper.readTree(body.readUtf8());
        String prompt = payload.path("contents").get(0).path("parts").get(0).path("text").asText();
        assertTrue(prompt.contains("Query: when are backups taken"));
        assertTrue(prompt.contains("Passage 0: Backups run nightly."));
        assertTrue(prompt.contains("Passage 1: " + "x".repeat(500) + "\n"));
        assertEquals(20, gemini.maxBatchSize());
    }

    private JsonNode answer(String text) throws Exception {
        return mapper.readTree("{\"candidates\": [{\"content\": {\"parts\": [{\"text\": "
                + mapper.writeValueAsString(text) + "}]}}]}");
    }
}
