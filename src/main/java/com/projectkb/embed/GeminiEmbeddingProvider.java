package com.projectkb.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Google Generative Language {@code models/{model}:batchEmbedContents}.
 */
public class GeminiEmbeddingProvider extends HttpEmbeddingProvider {
    private static final int PROVIDER_BATCH_LIMIT = 100;

    private final String baseUrl;
    private final String model;
    private final String apiKey;

    public GeminiEmbeddingProvider(OkHttpClient httpClient, String baseUrl, String model, String apiKey,
            int dimension, int maxBatchSize) {
        super(httpClient, dimension, Math.min(maxBatchSize, PROVIDER_BATCH_LIMIT));
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model.startsWith("models/") ? model : "models/" + model;
        this.apiKey = apiKey;
    }

    @Override
    protected Request buildRequest(List<String> texts) throws IOException {
        List<Map<String, Object>> requests = new ArrayList<>(texts.size());
        for (String text : texts) {
            requests.add(Map.of(
                    "model", model,
                    "content", Map.of("parts", List.of(Map.of("text", text)))));
        }
        String payload = mapper.writeValueAsString(Map.of("requests", requests));
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + "/" + model + ":batchEmbedContents")
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("x-goog-api-key", apiKey);
        }
        return builder.build();
    }

    @Override
    protected List<float[]> parseResponse(JsonNode root, int expected) throws EmbeddingProviderException {
        JsonNode embeddings = root.path("embeddings");
        if (!embeddings.isArray() || embeddings.size() != expected) {
            throw new EmbeddingProviderException("Expected " + expected + " embeddings in response", false);
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (JsonNode embedding : embeddings) {
            vectors.add(toVector(embedding.get("values")));
        }
        return vectors;
    }

    @Override
    public String name() {
        return "gemini:" + model;
    }
}
