package io.jobflow4j.core;

import io.jobflow4j.executor.ExecutorStatistics;
import io.jobflow4j.queue.QueueStatistics;
import io.jobflow4j.store.StorageStatistics;

import java.time.Instant;

public record SystemStatistics(
        SystemInfo system,
        StorageStatistics storage,
        QueueStatistics queue,
        ExecutorStatistics executor
) {

    public record SystemInfo(
            double uptimeSeconds,
            boolean running,
            Instant startTime
    ) {
    }
}
