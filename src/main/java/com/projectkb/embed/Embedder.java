package com.projectkb.embed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vectorizes texts through an {@link EmbeddingProvider} in order-preserving batches.
 * <p>
 * Transient failures are retried with exponential backoff. A batch that still fails is halved and
 * each half tried again, down to single inputs, so one bad input only fails itself.
 */
public class Embedder {
    private static final Logger log = LoggerFactory.getLogger(Embedder.class);

    private final EmbeddingProvider provider;
    private final ProviderGate gate;
    private final int batchSize;
    private final int maxRetries;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public Embedder(EmbeddingProvider provider, ProviderGate gate, int maxBatchSize, int maxRetries,
            long initialBackoffMs, long maxBackoffMs) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        if (maxRetries < 0 || initialBackoffMs < 0 || maxBackoffMs < 0) {
            throw new IllegalArgumentException("retry settings must be >= 0");
        }
        this.provider = provider;
        this.gate = gate;
        this.batchSize = Math.max(1, Math.min(maxBatchSize, provider.maxBatchSize()));
        this.maxRetries = maxRetries;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public int dimension() {
        return provider.dimension();
    }

    public EmbeddingBatch embed(List<String> texts) {
        EmbeddingOutcome[] outcomes = new EmbeddingOutcome[texts.size()];
        for (int start = 0; start < texts.size(); start += batchSize) {
            embedRange(texts, start, Math.min(texts.size(), start + batchSize), outcomes);
        }
        return new EmbeddingBatch(Arrays.asList(outcomes));
    }

    public float[] embedQuery(String query) throws EmbeddingException {
        EmbeddingOutcome outcome = embed(List.of(query)).outcomes().get(0);
        if (!outcome.succeeded()) {
            throw outcome.error();
        }
        return outcome.vector();
    }

    private void embedRange(List<String> texts, int from, int to, EmbeddingOutcome[] outcomes) {
        try {
            List<float[]> vectors = callWithRetries(texts.subList(from, to));
            for (int i = 0; i < vectors.size(); i++) {
                outcomes[from + i] = EmbeddingOutcome.success(vectors.get(i));
            }
        } catch (EmbeddingProviderException e) {
            if (to - from == 1) {
                log.warn("embed.item.failed provider={} index={} transient={} reason={}",
                        provider.name(), from, e.isTransient(), e.getMessage());
                outcomes[from] = EmbeddingOutcome.failure(
                        new EmbeddingException(from, "Input " + from + " could not be embedded: " + e.getMessage(), e));
                return;
            }
            int mid = from + (to - from) / 2;
            log.warn("embed.batch.split provider={} range={}..{} reason={}", provider.name(), from, to, e.getMessage());
            embedRange(texts, from, mid, outcomes);
            embedRange(texts, mid, to, outcomes);
        }
    }

    private List<float[]> callWithRetries(List<String> batch) throws EmbeddingProviderException {
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            EmbeddingProviderException failure;
            try {
                List<float[]> vectors = gate.withPermit(() -> provider.embed(batch));
                return validated(vectors, batch.size());
            } catch (EmbeddingProviderException e) {
                failure = e;
            } catch (GateTimeoutException e) {
                failure = new EmbeddingProviderException(e.getMessage(), true, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingProviderException("Interrupted while waiting for the provider", false, e);
            }
            if (!failure.isTransient() || attempt >= maxAttempts) {
                throw failure;
            }
            long backoff = backoffMillis(attempt);
            log.warn("embed.retry provider={} attempt={} maxAttempts={} backoffMs={} reason={}",
                    provider.name(), attempt, maxAttempts, backoff, failure.getMessage());
            sleep(backoff);
        }
    }

    long backoffMillis(int attempt) {
        long backoff = initialBackoffMs << Math.min(attempt - 1, 30);
        return Math.min(backoff, maxBackoffMs);
    }

    private List<float[]> validated(List<float[]> vectors, int expected) throws EmbeddingProviderException {
        if (vectors == null || vectors.size() != expected) {
            throw new EmbeddingProviderException("Expected " + expected + " vectors but got "
                    + (vectors == null ? 0 : vectors.size()), false);
        }
        List<float[]> out = new ArrayList<>(expected);
        for (float[] vector : vectors) {
            if (vector == null || vector.length != provider.dimension()) {
                throw new EmbeddingProviderException("Expected dimension " + provider.dimension() + " but got "
                        + (vector == null ? 0 : vector.length), false);
            }
            for (float value : vector) {
                if (!Float.isFinite(value)) {
                    throw new EmbeddingProviderException("Provider returned a non-finite component", false);
                }
            }
            out.add(vector.clone());
        }
        return out;
    }

    private static void sleep(long millis) throws EmbeddingProviderException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("Interrupted during backoff", false, e);
        }
    }
}
