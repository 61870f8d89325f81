package com.projectkb.retrieval;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Remote relevance model behind a JSON endpoint: posts {@code {model, query, document}} and reads
 * {@code {score}} back.
 */
public class HttpRelevanceScorer implements RelevanceScorer {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpRelevanceScorer(OkHttpClient httpClient, String endpoint, String model, String apiKey) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("rerank endpoint is required for the http scorer");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public double score(String query, String passage) throws RelevanceScoringException {
        ObjectNode payload = mapper.createObjectNode();
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        payload.put("query", query);
        payload.put("document", passage);

        Request.Builder builder = new Request.Builder().url(endpoint);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        try {
            Request request = builder.post(RequestBody.create(mapper.writeValueAsBytes(payload), JSON)).build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new RelevanceScoringException("Rerank endpoint returned HTTP " + response.code());
                }
                return parseScore(mapper.readTree(body.string()));
            }
        } catch (IOException e) {
            throw new RelevanceScoringException("Rerank call failed: " + e.getMessage(), e);
        }
    }

    static double parseScore(JsonNode root) throws RelevanceScoringException {
        JsonNode score = root == null ? null : root.get("score");
        if (score == null || !score.isNumber() || !Double.isFinite(score.asDouble())) {
            throw new RelevanceScoringException("Rerank response has no numeric score");
        }
        return score.asDouble();
    }

    @Override
    public String name() {
        return "http";
    }
}
