package io.jobflow4j.store;

public record StorageStatistics(
        long totalJobs,
        long pendingJobs,
        long runningJobs,
        long completedJobs,
        long failedJobs,
        long cancelledJobs,
        long retryJobs
) {
}
