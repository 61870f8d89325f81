package com.projectkb.job;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.projectkb.store.JsonFiles;
import com.projectkb.store.StorageException;

/**
 * One JSON file per job under {@code <dataDir>/jobs}, mirrored in memory. Updates of the same job
 * are serialized through {@link ConcurrentHashMap#compute}; a failed write leaves both the file and
 * the cached snapshot untouched.
 */
public class LocalJsonJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonJobStore.class);

    private final Path jobsDir;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Map<String, IngestionJob> jobs = new ConcurrentHashMap<>();

    public LocalJsonJobStore(Path dataDir) {
        this.jobsDir = dataDir.resolve("jobs");
        loadAll();
    }

    @Override
    public void insert(IngestionJob job) {
        jobs.compute(job.id(), (id, existing) -> {
            if (existing != null) {
                throw new IllegalStateException("Job " + id + " already exists");
            }
            persist(job);
            return job;
        });
    }

    @Override
    public Optional<IngestionJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public IngestionJob update(String jobId, UnaryOperator<IngestionJob> change) {
        IngestionJob updated = jobs.computeIfPresent(jobId, (id, current) -> {
            IngestionJob next = change.apply(current);
            if (next != current) {
                persist(next);
            }
            return next;
        });
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return updated;
    }

    @Override
    public List<IngestionJob> all() {
        return List.copyOf(jobs.values());
    }

    @Override
    public boolean delete(String jobId) {
        IngestionJob removed = jobs.remove(jobId);
        if (removed == null) {
            return false;
        }
        try {
            Files.deleteIfExists(fileFor(jobId));
        } catch (IOException e) {
            throw new StorageException("Unable to delete job file for " + jobId, e);
        }
        return true;
    }

    private void persist(IngestionJob job) {
        Path file = fileFor(job.id());
        try {
            JsonFiles.writeAtomically(mapper, file, job);
        } catch (IOException e) {
            throw new StorageException("Unable to write " + file, e);
        }
    }

    private void loadAll() {
        if (!Files.isDirectory(jobsDir)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(jobsDir, "*.json")) {
            for (Path file : files) {
                IngestionJob job = mapper.readValue(file.toFile(), IngestionJob.class);
                jobs.put(job.id(), job);
            }
        } catch (IOException e) {
            throw new StorageException("Unable to load jobs from " + jobsDir, e);
        }
        log.debug("jobs.loaded dir={} count={}", jobsDir, jobs.size());
    }

    private Path fileFor(String jobId) {
        if (jobId == null || !jobId.matches("[A-Za-z0-9._-]+") || jobId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return jobsDir.resolve(jobId + ".json");
    }
}
