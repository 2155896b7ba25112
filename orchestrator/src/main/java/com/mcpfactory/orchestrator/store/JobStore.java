package com.mcpfactory.orchestrator.store;

import com.mcpfactory.orchestrator.model.JobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Registry of job id → latest {@link JobRecord} snapshot.
 *
 * The only shared mutable resource in the pipeline. Implementations must make
 * {@link #create} and {@link #update} atomic per key: a reader sees either the
 * previous snapshot or the new one, never a mix of two writes.
 */
public interface JobStore {

    /** @throws DuplicateJobException if a job with this id already exists */
    void create(String id, JobRecord record);

    /**
     * Replace the whole record (last writer wins).
     *
     * @throws JobNotFoundException  if no job with this id exists
     * @throws IllegalStateException if the stored record is already terminal
     */
    void update(String id, JobRecord record);

    Optional<JobRecord> get(String id);

    /** The {@code limit} most recently created jobs, newest first. */
    List<JobRecord> list(int limit);
}
