package com.projectkb.embed;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectkb.runtime.AppConfig;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okio.Buffer;

class EmbeddingProvidersTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient httpClient = new OkHttpClient();

    @Test
    void shouldDefaultToHashingProvider() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setDimension(32);

        EmbeddingProvider provider = EmbeddingProviders.fromConfig(config, httpClient, Map.of());

        assertInstanceOf(HashingEmbeddingProvider.class, provider);
        assertEquals(32, provider.dimension());
    }

    @Test
    void shouldBuildOpenAiProviderWithKeyFromEnvironment() throws Exception {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("openai");
        config.setDimension(3);

        EmbeddingProvider provider = EmbeddingProviders.fromConfig(config, httpClient,
                Map.of("PROJECTKB_EMBEDDING_API_KEY", "secret"));

        OpenAiEmbeddingProvider openAi = assertInstanceOf(OpenAiEmbeddingProvider.class, provider);
        Request request = openAi.buildRequest(List.of("hello"));
        assertEquals("Bearer secret", request.header("Authorization"));
        assertEquals("https://api.openai.com/v1/embeddings", request.url().toString());
        Buffer body = new Buffer();
        request.body().writeTo(body);
        assertEquals("hello", mapper.readTree(body.readUtf8()).path("input").get(0).asText());
    }

    @Test
    void shouldRejectUnknownProvider() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("carrier-pigeon");

        assertThrows(IllegalArgumentException.class, () -> EmbeddingProviders.fromConfig(config, httpClient, Map.of()));
    }

    @Test
    void shouldOrderOpenAiVectorsByIndex() throws Exception {
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider(httpClient, "http://localhost/embeddings",
                "model", null, 2, 16);

        List<float[]> vectors = provider.parseResponse(mapper.readTree("""
                {"data": [
                  {"index": 1, "embedding": [0.3, 0.4]},
                  {"index": 0, "embedding": [0.1, 0.2]}
                ]}
                """), 2);

        assertArrayEquals(new float[] { 0.1f, 0.2f }, vectors.get(0));
        assertArrayEquals(new float[] { 0.3f, 0.4f }, vectors.get(1));
    }

    @Test
    void shouldRejectOpenAiResponseWithMissingItems() throws Exception {
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider(httpClient, "http://localhost/embeddings",
                "model", null, 2, 16);

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider.parseResponse(mapper.readTree("{\"data\": []}"), 2));
        assertFalse(error.isTransient());
    }

    @Test
    void shouldParseGeminiBatchResponse() throws Exception {
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(httpClient,
                "https://generativelanguage.googleapis.com/v1beta/", "text-embedding-004", "key", 2, 500);

        List<float[]> vectors = provider.parseResponse(mapper.readTree("""
                {"embeddings": [{"values": [1, 0]}, {"values": [0, 1]}]}
                """), 2);
        Request request = provider.buildRequest(List.of("a", "b"));

        assertArrayEquals(new float[] { 0f, 1f }, vectors.get(1));
        assertEquals(100, provider.maxBatchSize());
        assertEquals("key", request.header("x-goog-api-key"));
        assertTrue(request.url().toString().endsWith("/models/text-embedding-004:batchEmbedContents"));
    }

    @Test
    void shouldClassifyTransientStatuses() {
        assertTrue(EmbeddingProviderException.isTransientStatus(429));
        assertTrue(EmbeddingProviderException.isTransientStatus(503));
        assertFalse(EmbeddingProviderException.isTransientStatus(400));
    }

    @Test
    void shouldProduceNormalizedDeterministicHashingVectors() {
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(64);

        float[] first = provider.embed("vector search per project");
        float[] second = provider.embed("vector search per project");

        assertArrayEquals(first, second);
        double norm = 0;
        for (float value : first) {
            norm += value * value;
        }
        assertEquals(1.0, norm, 1e-4);
    }
}
