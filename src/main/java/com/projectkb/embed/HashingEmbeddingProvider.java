package com.projectkb.embed;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline embeddings from hashed word and character-trigram features. Deterministic, so it also
 * serves as the provider in tests and local runs without an API key.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }
        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int maxBatchSize() {
        return Integer.MAX_VALUE;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
