package com.projectkb.retrieval;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projectkb.embed.Embedder;
import com.projectkb.embed.EmbeddingException;
import com.projectkb.store.ScoredChunk;
import com.projectkb.store.VectorStore;

public class Retriever {
    private static final Logger log = LoggerFactory.getLogger(Retriever.class);

    private final Embedder embedder;
    private final VectorStore vectorStore;

    public Retriever(Embedder embedder, VectorStore vectorStore) {
        this.embedder = embedder;
        this.vectorStore = vectorStore;
    }

    /** Top-{@code k} chunks of the project by similarity to {@code query}, closest first. */
    public List<RetrievedChunk> retrieve(String projectId, String query, int k) {
        float[] queryEmbedding;
        try {
            queryEmbedding = embedder.embedQuery(query);
        } catch (EmbeddingException e) {
            throw new RetrievalException("Query could not be embedded: " + e.getMessage(), e);
        }
        List<ScoredChunk> nearest = vectorStore.search(projectId, queryEmbedding, k);
        List<RetrievedChunk> candidates = new ArrayList<>(nearest.size());
        for (int rank = 0; rank < nearest.size(); rank++) {
            ScoredChunk scored = nearest.get(rank);
            candidates.add(new RetrievedChunk(scored.chunk(), scored.distance(), rank));
        }
        log.debug("retrieve project={} k={} candidates={}", projectId, k, candidates.size());
        return candidates;
    }
}
