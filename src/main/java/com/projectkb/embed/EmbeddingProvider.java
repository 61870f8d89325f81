package com.projectkb.embed;

import java.util.List;

/**
 * One external (or local) embedding backend. Implementations return one vector per input, in
 * input order, and signal failure of the whole call with {@link EmbeddingProviderException}.
 */
public interface EmbeddingProvider {
    List<float[]> embed(List<String> texts) throws EmbeddingProviderException;

    int dimension();

    int maxBatchSize();

    default String name() {
        return getClass().getSimpleName();
    }
}
