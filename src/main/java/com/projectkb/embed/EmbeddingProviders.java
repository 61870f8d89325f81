package com.projectkb.embed;

import java.util.Locale;
import java.util.Map;

import com.projectkb.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient,
            Map<String, String> environment) {
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        String apiKey = config.getApiKeyEnv() == null ? null : environment.get(config.getApiKeyEnv());
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingProvider(config.getDimension());
            case "openai" -> new OpenAiEmbeddingProvider(httpClient,
                    endpointOrDefault(config, "https://api.openai.com/v1/embeddings"),
                    config.getModel(), apiKey, config.getDimension(), config.getMaxBatchSize());
            case "gemini" -> new GeminiEmbeddingProvider(httpClient,
                    endpointOrDefault(config, "https://generativelanguage.googleapis.com/v1beta"),
                    config.getModel(), apiKey, config.getDimension(), config.getMaxBatchSize());
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        };
    }

    private static String endpointOrDefault(AppConfig.EmbeddingConfig config, String fallback) {
        String endpoint = config.getEndpoint();
        return endpoint == null || endpoint.isBlank() ? fallback : endpoint;
    }
}
