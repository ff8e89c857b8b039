package io.jobflow4j.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Flat, serializable projection of a {@link Job}: the command in its tagged string form,
 * enums by name/value and timestamps as epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRecord(
        String id,
        String name,
        String command,
        Map<String, Object> parameters,
        String status,
        int priority,
        long createdAt,
        Long scheduledAt,
        Long startedAt,
        Long completedAt,
        int retryCount,
        int maxRetries,
        Integer timeout,
        List<String> tags,
        Map<String, Object> metadata,
        String errorMessage,
        Map<String, Object> result
) {

    public static JobRecord from(Job job) {
        return new JobRecord(
                job.getId(),
                job.getName(),
                job.getCommand().asString(),
                job.getParameters(),
                job.getStatus().name(),
                job.getPriority().value(),
                job.getCreatedAt().toEpochMilli(),
                toMillis(job.getScheduledAt()),
                toMillis(job.getStartedAt()),
                toMillis(job.getCompletedAt()),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getTimeout(),
                List.copyOf(job.getTags()),
                job.getMetadata(),
                job.getErrorMessage(),
                job.getResult()
        );
    }

    public Job toJob() {
        return new Job(
                id,
                name,
                Command.parse(command),
                parameters,
                Priority.fromValue(priority),
                timeout,
                maxRetries,
                tags == null ? null : new LinkedHashSet<>(tags),
                metadata,
                JobStatus.valueOf(status),
                Instant.ofEpochMilli(createdAt),
                toInstant(scheduledAt),
                toInstant(startedAt),
                toInstant(completedAt),
                retryCount,
                errorMessage,
                result
        );
    }

    private static Long toMillis(Instant t) {
        return t == null ? null : t.toEpochMilli();
    }

    private static Instant toInstant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }
}
