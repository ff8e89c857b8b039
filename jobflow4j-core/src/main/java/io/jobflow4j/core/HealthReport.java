package io.jobflow4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Result of {@code Jobflow.health()}.
 *
 * @param components component name to "is up" (system, executor, scheduler, storage)
 * @param warning    set when the status is DEGRADED, otherwise null
 */
public record HealthReport(
        HealthStatus status,
        Instant timestamp,
        Map<String, Boolean> components,
        String warning
) {
}
