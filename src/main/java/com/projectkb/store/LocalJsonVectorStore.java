package com.projectkb.store;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * File-backed vector store with one JSON partition per project under {@code <dataDir>/projects}.
 * <p>
 * Searches only ever read the requested project's partition, so another tenant's chunks are never
 * candidates. Writes to a partition are serialized and persisted before they become visible; reads
 * work on an immutable snapshot and take no lock.
 */
public class LocalJsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorStore.class);
    private static final Comparator<ScoredChunk> NEAREST_FIRST = Comparator
            .comparingDouble(ScoredChunk::distance)
            .thenComparingLong(scored -> scored.chunk().sequence());

    private final Path projectsDir;
    private final int dimension;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();

    public LocalJsonVectorStore(Path dataDir, int dimension) {
        this(dataDir, dimension, Clock.systemUTC());
    }

    public LocalJsonVectorStore(Path dataDir, int dimension, Clock clock) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.projectsDir = dataDir.resolve("projects");
        this.dimension = dimension;
        this.clock = clock;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public Document registerDocument(Document document) {
        mutate(document.projectId(), state -> {
            if (state.document(document.id()).isPresent()) {
                throw new IllegalStateException("Document " + document.id() + " already registered");
            }
            List<Document> documents = new ArrayList<>(state.documents());
            documents.add(document);
            return new PartitionState(state.projectId(), state.nextSequence(), documents, state.chunks());
        });
        return document;
    }

    @Override
    public Document appendChunks(String projectId, String documentId, String resolvedContentType,
            boolean partialExtraction, List<ChunkDraft> drafts) {
        for (int i = 0; i < drafts.size(); i++) {
            ChunkDraft draft = drafts.get(i);
            if (draft.index() != i) {
                throw new IllegalArgumentException("Chunk indices must be contiguous from 0, got " + draft.index()
                        + " at position " + i);
            }
            if (draft.embedding() == null || draft.embedding().length != dimension) {
                throw new IllegalArgumentException("Chunk " + i + " embedding must have dimension " + dimension);
            }
        }
        PartitionState next = mutate(projectId, state -> {
            Document document = state.document(documentId)
                    .orElseThrow(() -> new DocumentNotFoundException(projectId, documentId));
            if (document.status() == DocumentStatus.READY) {
                throw new IllegalStateException("Document " + documentId + " already has its chunks");
            }
            long sequence = state.nextSequence();
            List<StoredChunk> chunks = new ArrayList<>(state.chunks().size() + drafts.size());
            chunks.addAll(state.chunks());
            for (ChunkDraft draft : drafts) {
                chunks.add(new StoredChunk(
                        UUID.randomUUID().toString(),
                        projectId,
                        documentId,
                        draft.index(),
                        draft.text(),
                        VectorMath.normalized(draft.embedding()),
                        draft.startOffset(),
                        draft.endOffset(),
                        draft.overlapLength(),
                        sequence++,
                        draft.metadata(),
                        clock.instant()));
            }
            Document ready = document.ready(resolvedContentType, partialExtraction, drafts.size());
            return new PartitionState(projectId, sequence, state.replace(ready), chunks);
        });
        log.debug("store.append project={} document={} chunks={}", projectId, documentId, drafts.size());
        return next.document(documentId).orElseThrow();
    }

    @Override
    public Document markFailed(String projectId, String documentId, String message) {
        PartitionState next = mutate(projectId, state -> {
            Document document = state.document(documentId)
                    .orElseThrow(() -> new DocumentNotFoundException(projectId, documentId));
            if (document.status() == DocumentStatus.READY) {
                throw new IllegalStateException("Document " + documentId + " is already ready");
            }
            return new PartitionState(projectId, state.nextSequence(), state.replace(document.failed(message)),
                    state.chunks());
        });
        return next.document(documentId).orElseThrow();
    }

    @Override
    public List<ScoredChunk> search(String projectId, float[] queryEmbedding, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        if (queryEmbedding.length != dimension) {
            throw new IllegalArgumentException("Query embedding must have dimension " + dimension);
        }
        float[] query = VectorMath.normalized(queryEmbedding);
        PartitionState state = read(projectId);
        PriorityQueue<ScoredChunk> worstFirst = new PriorityQueue<>(k + 1, NEAREST_FIRST.reversed());
        for (StoredChunk chunk : state.chunks()) {
            if (!projectId.equals(chunk.projectId())) {
                throw new TenantIsolationViolation(projectId, chunk.projectId(), chunk.id());
            }
            worstFirst.add(new ScoredChunk(chunk, VectorMath.cosineDistance(query, chunk.vector())));
            if (worstFirst.size() > k) {
                worstFirst.poll();
            }
        }
        List<ScoredChunk> nearest = new ArrayList<>(worstFirst);
        nearest.sort(NEAREST_FIRST);
        return nearest;
    }

    @Override
    public Optional<Document> findDocument(String projectId, String documentId) {
        return read(projectId).document(documentId);
    }

    @Override
    public List<Document> listDocuments(String projectId) {
        return read(projectId).documents();
    }

    @Override
    public List<StoredChunk> chunksOf(String projectId, String documentId) {
        return read(projectId).chunks().stream()
                .filter(chunk -> chunk.documentId().equals(documentId))
                .sorted(Comparator.comparingInt(StoredChunk::index))
                .toList();
    }

    @Override
    public boolean deleteDocument(String projectId, String documentId) {
        if (findDocument(projectId, documentId).isEmpty()) {
            return false;
        }
        mutate(projectId, state -> {
            List<Document> documents = state.documents().stream()
                    .filter(document -> !document.id().equals(documentId))
                    .toList();
            List<StoredChunk> chunks = state.chunks().stream()
                    .filter(chunk -> !chunk.documentId().equals(documentId))
                    .toList();
            return new PartitionState(projectId, state.nextSequence(), documents, chunks);
        });
        log.info("store.document.deleted project={} document={}", projectId, documentId);
        return true;
    }

    private PartitionState mutate(String projectId, UnaryOperator<PartitionState> change) {
        Partition partition = partition(projectId);
        synchronized (partition) {
            PartitionState next = change.apply(partition.state);
            Path file = fileFor(projectId);
            try {
                JsonFiles.writeAtomically(mapper, file, next);
            } catch (IOException e) {
                throw new StorageException("Unable to write " + file, e);
            }
            partition.state = next;
            return next;
        }
    }

    private Partition partition(String projectId) {
        requireProjectId(projectId);
        return partitions.computeIfAbsent(projectId, this::load);
    }

    /** Current state without caching a partition that was never written. */
    private PartitionState read(String projectId) {
        requireProjectId(projectId);
        Partition cached = partitions.get(projectId);
        if (cached != null) {
            return cached.state;
        }
        if (!Files.exists(fileFor(projectId))) {
            return PartitionState.empty(projectId);
        }
        return partition(projectId).state;
    }

    int cachedPartitions() {
        return partitions.size();
    }

    private static void requireProjectId(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
    }

    private Partition load(String projectId) {
        Path file = fileFor(projectId);
        if (!Files.exists(file)) {
            return new Partition(PartitionState.empty(projectId));
        }
        try {
            PartitionState state = mapper.readValue(file.toFile(), PartitionState.class);
            if (!projectId.equals(state.projectId())) {
                throw new StorageException("Partition " + file + " belongs to project " + state.projectId(), null);
            }
            return new Partition(state);
        } catch (IOException e) {
            throw new StorageException("Unable to read " + file, e);
        }
    }

    private Path fileFor(String projectId) {
        return projectsDir.resolve(URLEncoder.encode(projectId, StandardCharsets.UTF_8) + ".json");
    }

    private static final class Partition {
        private volatile PartitionState state;

        private Partition(PartitionState state) {
            this.state = state;
        }
    }

    public record PartitionState(String projectId, long nextSequence, List<Document> documents,
            List<StoredChunk> chunks) {
        public PartitionState {
            documents = documents == null ? List.of() : List.copyOf(documents);
            chunks = chunks == null ? List.of() : List.copyOf(chunks);
        }

        static PartitionState empty(String projectId) {
            return new PartitionState(projectId, 0L, List.of(), List.of());
        }

        Optional<Document> document(String documentId) {
            return documents.stream().filter(document -> document.id().equals(documentId)).findFirst();
        }

        List<Document> replace(Document updated) {
            return documents.stream()
                    .map(document -> document.id().equals(updated.id()) ? updated : document)
                    .toList();
        }
    }
}
