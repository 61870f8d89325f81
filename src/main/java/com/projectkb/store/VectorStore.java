package com.projectkb.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of documents and their embedded chunks. Every operation is scoped to one project.
 */
public interface VectorStore {
    int dimension();

    Document registerDocument(Document document);

    /**
     * Stores the whole chunk sequence of a document and marks it ready, as one unit: afterwards
     * either all chunks are visible or none are.
     */
    Document appendChunks(String projectId, String documentId, String resolvedContentType, boolean partialExtraction,
            List<ChunkDraft> chunks);

    Document markFailed(String projectId, String documentId, String message);

    /**
     * The {@code k} chunks of {@code projectId} closest to {@code queryEmbedding}, by increasing
     * cosine distance, earlier insertion first on equal distance.
     */
    List<ScoredChunk> search(String projectId, float[] queryEmbedding, int k);

    Optional<Document> findDocument(String projectId, String documentId);

    List<Document> listDocuments(String projectId);

    List<StoredChunk> chunksOf(String projectId, String documentId);

    /** Removes the document and all of its chunks; false when it did not exist. */
    boolean deleteDocument(String projectId, String documentId);
}
