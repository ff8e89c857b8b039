package io.jobflow4j.executor;

/**
 * Snapshot of {@link TaskExecutor} counters, read under the executor's in-flight lock.
 */
public record ExecutorStatistics(
        int runningJobs,
        long jobsCompleted,
        long jobsFailed,
        long jobsCancelled,
        double totalExecutionTimeSeconds,
        int maxWorkers,
        boolean running
) {
}
