package com.projectkb.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * OpenAI-compatible {@code POST /embeddings}: {@code {"model", "input": [...]}} answered with
 * {@code {"data": [{"index", "embedding"}]}}.
 */
public class OpenAiEmbeddingProvider extends HttpEmbeddingProvider {
    private final String endpoint;
    private final String model;
    private final String apiKey;

    public OpenAiEmbeddingProvider(OkHttpClient httpClient, String endpoint, String model, String apiKey,
            int dimension, int maxBatchSize) {
        super(httpClient, dimension, maxBatchSize);
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    protected Request buildRequest(List<String> texts) throws IOException {
        String payload = mapper.writeValueAsString(Map.of("model", model, "input", texts));
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    @Override
    protected List<float[]> parseResponse(JsonNode root, int expected) throws EmbeddingProviderException {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingProviderException("Expected " + expected + " embeddings in response", false);
        }
        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= expected || ordered[index] != null) {
                throw new EmbeddingProviderException("Invalid embedding index " + index, false);
            }
            ordered[index] = toVector(item.get("embedding"));
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }

    @Override
    public String name() {
        return "openai:" + model;
    }
}
