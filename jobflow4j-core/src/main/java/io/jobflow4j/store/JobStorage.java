package io.jobflow4j.store;

import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point to job persistence for the executor, the scheduler and API callers.
 *
 * <p>Wraps one {@link JobStore} backend. A failing backend call is logged and reported as
 * {@code false}, empty or {@code 0}; it never propagates, so one bad write cannot stop the
 * background loops.
 */
public class JobStorage {
    private static final Logger log = LoggerFactory.getLogger(JobStorage.class);

    private final JobStore backend;

    public JobStorage(JobStore backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    public JobStore backend() {
        return backend;
    }

    public boolean save(Job job) {
        try {
            backend.save(job);
            return true;
        } catch (Exception e) {
            log.error("jobflow storage save failed id={} msg={}", job.getId(), e.getMessage(), e);
            return false;
        }
    }

    public boolean update(Job job) {
        try {
            backend.update(job);
            return true;
        } catch (Exception e) {
            log.error("jobflow storage update failed id={} msg={}", job.getId(), e.getMessage(), e);
            return false;
        }
    }

    public Optional<Job> get(String id) {
        try {
            return backend.get(id);
        } catch (Exception e) {
            log.error("jobflow storage get failed id={} msg={}", id, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public boolean delete(String id) {
        try {
            return backend.delete(id);
        } catch (Exception e) {
            log.error("jobflow storage delete failed id={} msg={}", id, e.getMessage(), e);
            return false;
        }
    }

    public List<Job> list(JobStatus status, Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        try {
            return backend.list(status, limit);
        } catch (Exception e) {
            log.error("jobflow storage list failed status={} limit={} msg={}", status, limit, e.getMessage(), e);
            return List.of();
        }
    }

    public List<Job> list() {
        return list(null, null);
    }

    public long count(JobStatus status) {
        try {
            return backend.count(status);
        } catch (Exception e) {
            log.error("jobflow storage count failed status={} msg={}", status, e.getMessage(), e);
            return 0;
        }
    }

    public long count() {
        return count(null);
    }

    public List<Job> byTag(String tag) {
        return list().stream()
                .filter(j -> j.hasTag(tag))
                .collect(Collectors.toList());
    }

    /**
     * Deletes finished jobs (COMPLETED, FAILED, CANCELLED) created more than {@code olderThanDays}
     * days ago. Zero days covers every finished job.
     */
    public int cleanup(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new IllegalArgumentException("olderThanDays must not be negative");
        }
        Instant cutoff = ZonedDateTime.ofInstant(nowInstant(), ZoneId.systemDefault())
                .minusDays(olderThanDays)
                .toInstant();
        try {
            int deleted = backend.cleanup(cutoff);
            log.info("jobflow storage cleanup deleted={} cutoff={}", deleted, cutoff);
            return deleted;
        } catch (Exception e) {
            log.error("jobflow storage cleanup failed cutoff={} msg={}", cutoff, e.getMessage(), e);
            return 0;
        }
    }

    public boolean healthCheck() {
        try {
            return backend.healthCheck();
        } catch (Exception e) {
            log.warn("jobflow storage health check failed msg={}", e.getMessage(), e);
            return false;
        }
    }

    public StorageStatistics statistics() {
        return new StorageStatistics(
                count(),
                count(JobStatus.PENDING),
                count(JobStatus.RUNNING),
                count(JobStatus.COMPLETED),
                count(JobStatus.FAILED),
                count(JobStatus.CANCELLED),
                count(JobStatus.RETRY)
        );
    }

    protected Instant nowInstant() {
        return Instant.now();
    }
}
