package com.projectkb.job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable job records. {@link #update} is the only way to change a stored job: the change runs as
 * one atomic read-modify-write and is persisted before any reader can observe it.
 */
public interface JobStore {
    void insert(IngestionJob job);

    Optional<IngestionJob> find(String jobId);

    /** @throws JobNotFoundException when no job has this id */
    IngestionJob update(String jobId, UnaryOperator<IngestionJob> change);

    List<IngestionJob> all();

    boolean delete(String jobId);
}
