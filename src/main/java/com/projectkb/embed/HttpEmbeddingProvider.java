package com.projectkb.embed;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Shared request/response handling for JSON-over-HTTP embedding providers. Subclasses only know
 * their provider's request and response shapes.
 */
public abstract class HttpEmbeddingProvider implements EmbeddingProvider {
    protected static final MediaType JSON = MediaType.parse("application/json");

    protected final OkHttpClient httpClient;
    protected final ObjectMapper mapper = new ObjectMapper();
    private final int dimension;
    private final int maxBatchSize;

    protected HttpEmbeddingProvider(OkHttpClient httpClient, int dimension, int maxBatchSize) {
        this.httpClient = httpClient;
        this.dimension = dimension;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts) throws EmbeddingProviderException {
        if (texts.isEmpty()) {
            return List.of();
        }
        Request request;
        try {
            request = buildRequest(texts);
        } catch (IOException e) {
            throw new EmbeddingProviderException("Unable to encode embedding request", false, e);
        }
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new EmbeddingProviderException(name() + " returned HTTP " + response.code(),
                        EmbeddingProviderException.isTransientStatus(response.code()));
            }
            if (body == null) {
                throw new EmbeddingProviderException(name() + " returned an empty body", true);
            }
            return parseResponse(mapper.readTree(body.string()), texts.size());
        } catch (IOException e) {
            throw new EmbeddingProviderException(name() + " call failed: " + e.getMessage(), true, e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    protected abstract Request buildRequest(List<String> texts) throws IOException;

    protected abstract List<float[]> parseResponse(JsonNode root, int expected) throws EmbeddingProviderException;

    protected static float[] toVector(JsonNode vectorNode) throws EmbeddingProviderException {
        if (vectorNode == null || !vectorNode.isArray()) {
            throw new EmbeddingProviderException("Response is missing an embedding array", false);
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
