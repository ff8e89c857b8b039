package io.jobflow4j.queue;

import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;

import java.util.Map;

/**
 * Snapshot of {@link JobQueue} counters.
 *
 * @param addedByPriority lifetime additions per priority
 * @param priorityBreakdown jobs currently queued per priority
 * @param statusBreakdown jobs currently queued per status
 */
public record QueueStatistics(
        long totalAdded,
        long totalRetrieved,
        long totalRemoved,
        Map<Priority, Long> addedByPriority,
        int currentSize,
        Map<Priority, Integer> priorityBreakdown,
        Map<JobStatus, Integer> statusBreakdown
) {
}
