package com.projectkb.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projectkb.embed.ProviderGate;

/**
 * Reorders similarity candidates by a {@link RelevanceScorer} and keeps the best {@code m}.
 * <p>
 * Candidates are scored concurrently in batches of {@link RelevanceScorer#maxBatchSize()}, each
 * call through the shared {@link ProviderGate}, all within one time budget. Equal scores keep
 * similarity order. When nothing could be scored the first {@code m} candidates are returned as
 * retrieved; candidates whose own batch failed follow every scored one, in similarity order.
 */
public class Reranker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Reranker.class);
    private static final Comparator<RankedChunk> BY_SCORE_THEN_SIMILARITY = Comparator
            .comparing(RankedChunk::reranked).reversed()
            .thenComparing(Comparator.comparingDouble(
                    (RankedChunk ranked) -> ranked.reranked() ? ranked.relevanceScore() : 0.0).reversed())
            .thenComparingInt(ranked -> ranked.candidate().rank());

    private final RelevanceScorer scorer;
    private final ProviderGate gate;
    private final long timeoutMs;
    private final ExecutorService executor;

    /**
     * @param scorer null disables reranking
     * @param executor runs the scoring calls; owned by this reranker and shut down on {@link #close()}
     */
    public Reranker(RelevanceScorer scorer, ProviderGate gate, long timeoutMs, ExecutorService executor) {
        this.scorer = scorer;
        this.gate = gate;
        this.timeoutMs = timeoutMs;
        this.executor = executor;
    }

    public boolean enabled() {
        return scorer != null;
    }

    public List<RankedChunk> rerank(String query, List<RetrievedChunk> candidates, int m) {
        if (m <= 0) {
            throw new IllegalArgumentException("m must be > 0");
        }
        if (scorer == null || candidates.isEmpty()) {
            return similarityOrder(candidates, m);
        }
        try {
            List<RankedChunk> ranked = new ArrayList<>(scoreAll(query, candidates));
            ranked.sort(BY_SCORE_THEN_SIMILARITY);
            return List.copyOf(ranked.subList(0, Math.min(m, ranked.size())));
        } catch (RerankerUnavailableException e) {
            log.warn("rerank.fallback scorer={} candidates={} reason={}", scorer.name(), candidates.size(),
                    e.getMessage());
            return similarityOrder(candidates, m);
        }
    }

    private List<RankedChunk> scoreAll(String query, List<RetrievedChunk> candidates)
            throws RerankerUnavailableException {
        int batchSize = Math.max(1, scorer.maxBatchSize());
        List<List<RetrievedChunk>> batches = new ArrayList<>();
        List<Future<List<Double>>> calls = new ArrayList<>();
        for (int start = 0; start < candidates.size(); start += batchSize) {
            List<RetrievedChunk> batch = candidates.subList(start, Math.min(candidates.size(), start + batchSize));
            List<String> passages = batch.stream().map(candidate -> candidate.chunk().text()).toList();
            batches.add(batch);
            calls.add(executor.submit(() -> gate.withPermit(() -> scorer.scoreBatch(query, passages))));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<RankedChunk> ranked = new ArrayList<>(candidates.size());
        int scored = 0;
        Throwable lastFailure = null;
        for (int b = 0; b < batches.size(); b++) {
            Future<List<Double>> call = calls.get(b);
            List<RetrievedChunk> batch = batches.get(b);
            List<Double> scores;
            try {
                scores = call.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                lastFailure = e.getCause();
                log.debug("rerank.batch.failed first={} size={} reason={}", batch.get(0).rank(), batch.size(),
                        e.getCause().getMessage());
                batch.forEach(candidate -> ranked.add(RankedChunk.unscored(candidate)));
                continue;
            } catch (TimeoutException e) {
                call.cancel(true);
                lastFailure = e;
                log.debug("rerank.batch.timeout first={} size={} timeoutMs={}", batch.get(0).rank(), batch.size(),
                        timeoutMs);
                batch.forEach(candidate -> ranked.add(RankedChunk.unscored(candidate)));
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                calls.forEach(pending -> pending.cancel(true));
                throw new RerankerUnavailableException("Interrupted while reranking", e);
            }
            if (scores == null || scores.size() != batch.size()) {
                lastFailure = new RelevanceScoringException("Scorer returned "
                        + (scores == null ? "nothing" : scores.size() + " scores") + " for " + batch.size()
                        + " passages");
                batch.forEach(candidate -> ranked.add(RankedChunk.unscored(candidate)));
                continue;
            }
            for (int i = 0; i < batch.size(); i++) {
                Double score = scores.get(i);
                if (score == null || !Double.isFinite(score)) {
                    lastFailure = new RelevanceScoringException("Scorer returned " + score);
                    ranked.add(RankedChunk.unscored(batch.get(i)));
                } else {
                    ranked.add(new RankedChunk(batch.get(i), score));
                    scored++;
                }
            }
        }
        if (scored == 0) {
            throw new RerankerUnavailableException("No candidate could be scored: "
                    + (lastFailure == null ? "unknown" : lastFailure.getMessage()), lastFailure);
        }
        if (scored < candidates.size()) {
            log.warn("rerank.partial scorer={} scored={} candidates={}", scorer.name(), scored, candidates.size());
        }
        return ranked;
    }

    private static List<RankedChunk> similarityOrder(List<RetrievedChunk> candidates, int m) {
        return candidates.stream()
                .sorted(Comparator.comparingInt(RetrievedChunk::rank))
                .limit(m)
                .map(RankedChunk::unscored)
                .toList();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
