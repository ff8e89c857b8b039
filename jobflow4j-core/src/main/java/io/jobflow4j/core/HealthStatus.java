package io.jobflow4j.core;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
