package com.projectkb.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Uses a Gemini model as relevance judge: one {@code generateContent} call rates a whole batch of
 * passages from 0 to 10 and answers with a JSON array of scores in passage order.
 */
public class GeminiRelevanceScorer implements RelevanceScorer {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_PASSAGE_CHARS = 500;
    private static final String INSTRUCTIONS = """
            You evaluate how relevant text passages are to a search query.
            Rate each passage from 0 to 10:
            10 = directly answers the query
            7-9 = contains important information for the query
            4-6 = contains related information
            1-3 = tangentially related
            0 = not relevant
            Answer with a JSON array of numbers only, one per passage, in passage order. Example: [8, 3, 9]
            """;

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final int maxBatchSize;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeminiRelevanceScorer(OkHttpClient httpClient, String baseUrl, String model, String apiKey,
            int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("rerank batch size must be > 0");
        }
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model.startsWith("models/") ? model : "models/" + model;
        this.apiKey = apiKey;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public double score(String query, String passage) throws RelevanceScoringException {
        return scoreBatch(query, List.of(passage)).get(0);
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public List<Double> scoreBatch(String query, List<String> passages) throws RelevanceScoringException {
        if (passages.isEmpty()) {
            return List.of();
        }
        try (Response response = httpClient.newCall(buildRequest(query, passages)).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new RelevanceScoringException(name() + " returned HTTP " + response.code());
            }
            return parseScores(mapper.readTree(body.string()), passages.size());
        } catch (IOException e) {
            throw new RelevanceScoringException(name() + " call failed: " + e.getMessage(), e);
        }
    }

    Request buildRequest(String query, List<String> passages) throws IOException {
        StringBuilder prompt = new StringBuilder("Query: ").append(query).append("\n\nPassages:\n");
        for (int i = 0; i < passages.size(); i++) {
            String passage = passages.get(i);
            String excerpt = passage.length() > MAX_PASSAGE_CHARS ? passage.substring(0, MAX_PASSAGE_CHARS) : passage;
            prompt.append("Passage ").append(i).append(": ").append(excerpt.replace('\n', ' ')).append('\n');
        }
        Map<String, Object> payload = Map.of(
                "systemInstruction", Map.of("parts", List.of(Map.of("text", INSTRUCTIONS))),
                "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt.toString())))),
                "generationConfig", Map.of("temperature", 0, "responseMimeType", "application/json"));
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + "/" + model + ":generateContent")
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("x-goog-api-key", apiKey);
        }
        return builder.build();
    }

    /** Reads the score array out of the model's text answer; the count must match the passages sent. */
    List<Double> parseScores(JsonNode root, int expected) throws RelevanceScoringException {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        String answer = stripCodeFence(text.toString().strip());
        if (answer.isEmpty()) {
            throw new RelevanceScoringException(name() + " returned no text");
        }
        JsonNode scores;
        try {
            scores = mapper.readTree(answer);
        } catch (IOException e) {
            throw new RelevanceScoringException(name() + " answer is not JSON: " + e.getMessage(), e);
        }
        if (scores == null || !scores.isArray() || scores.size() != expected) {
            throw new RelevanceScoringException(name() + " returned " + (scores != null && scores.isArray()
                    ? scores.size() + " scores" : "no score array") + " for " + expected + " passages");
        }
        List<Double> out = new ArrayList<>(expected);
        for (JsonNode score : scores) {
            if (!score.isNumber() || !Double.isFinite(score.asDouble())) {
                throw new RelevanceScoringException(name() + " returned a non-numeric score: " + score);
            }
            out.add(score.asDouble());
        }
        return out;
    }

    private static String stripCodeFence(String answer) {
        if (!answer.startsWith("```")) {
            return answer;
        }
        int firstLineEnd = answer.indexOf('\n');
        int closing = answer.lastIndexOf("```");
        if (firstLineEnd < 0 || closing <= firstLineEnd) {
            return answer;
        }
        return answer.substring(firstLineEnd + 1, closing).strip();
    }

    @Override
    public String name() {
        return "gemini:" + model;
    }
}
