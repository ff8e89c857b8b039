package io.jobflow4j.store;

import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of jobs, one record per job id.
 *
 * <p>Implementations throw {@link JobStoreException} on backend failures; callers go through
 * {@link JobStorage}, which contains them. Implementations must be safe for concurrent use by
 * executor workers and read-only consumers.
 */
public interface JobStore {

    /**
     * Insert or replace the record for {@code job.getId()}.
     */
    void save(Job job);

    Optional<Job> get(String id);

    /**
     * Same as {@link #save(Job)}.
     */
    default void update(Job job) {
        save(job);
    }

    boolean delete(String id);

    /**
     * Jobs ordered by creation time, newest first.
     *
     * @param status null for all statuses
     * @param limit  null for no limit
     */
    List<Job> list(JobStatus status, Integer limit);

    /**
     * @param status null for all statuses
     */
    long count(JobStatus status);

    /**
     * Deletes jobs in a {@link JobStatus#isCleanupEligible() cleanup-eligible} status created before
     * {@code cutoff}.
     *
     * @return number of deleted jobs
     */
    int cleanup(Instant cutoff);

    /**
     * Cheap liveness probe of the backend.
     */
    boolean healthCheck();
}
