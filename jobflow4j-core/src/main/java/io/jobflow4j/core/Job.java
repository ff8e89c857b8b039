package io.jobflow4j.core;

import io.jobflow4j.utils.JsonValues;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The unit of schedulable work.
 *
 * <p>Descriptive fields are fixed at creation. Lifecycle fields change only through the
 * {@code mark*} transitions, which follow {@link JobStatus#canTransitionTo(JobStatus)}:
 * <pre>
 *   PENDING -> RUNNING -> COMPLETED
 *                      -> FAILED -> RETRY -> PENDING   (while retryCount &lt; maxRetries)
 *   PENDING | RUNNING | RETRY -> CANCELLED
 * </pre>
 *
 * <p>All timestamps are truncated to milliseconds. Parameters, metadata and result are held in
 * their JSON form (see {@link JsonValues}), so a job equals its stored copy.
 */
public class Job {

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String id;
    private final String name;
    private final Command command;
    private final Map<String, Object> parameters;
    private final Set<String> tags;
    private final Map<String, Object> metadata;
    private final Priority priority;
    private final Integer timeout;
    private final int maxRetries;
    private final Instant createdAt;

    private JobStatus status;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;
    private int retryCount;
    private String errorMessage;
    private Map<String, Object> result;

    /**
     * Creates a new PENDING job with a fresh id.
     */
    public Job(String name,
               Command command,
               Map<String, Object> parameters,
               Priority priority,
               Integer timeout,
               int maxRetries,
               Set<String> tags,
               Map<String, Object> metadata) {
        this(UUID.randomUUID().toString(), name, command, parameters, priority, timeout, maxRetries, tags, metadata,
                JobStatus.PENDING, now(), null, null, null, 0, null, null);
    }

    /**
     * Rehydrates a persisted job. {@code scheduledAt} falls back to {@code createdAt}.
     */
    public Job(String id,
               String name,
               Command command,
               Map<String, Object> parameters,
               Priority priority,
               Integer timeout,
               int maxRetries,
               Set<String> tags,
               Map<String, Object> metadata,
               JobStatus status,
               Instant createdAt,
               Instant scheduledAt,
               Instant startedAt,
               Instant completedAt,
               int retryCount,
               String errorMessage,
               Map<String, Object> result) {
        this.id = requireNonBlank(id, "id");
        this.name = requireNonBlank(name, "name");
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.parameters = parameters == null ? new LinkedHashMap<>() : JsonValues.normalize(parameters, "parameters");
        this.priority = priority == null ? Priority.NORMAL : priority;
        if (timeout != null && timeout <= 0) {
            throw new IllegalArgumentException("timeout must be a positive number of seconds");
        }
        this.timeout = timeout;
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
        this.metadata = metadata == null ? new LinkedHashMap<>() : JsonValues.normalize(metadata, "metadata");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.createdAt = truncate(Objects.requireNonNull(createdAt, "createdAt must not be null"));
        this.scheduledAt = scheduledAt == null ? this.createdAt : truncate(scheduledAt);
        this.startedAt = truncate(startedAt);
        this.completedAt = truncate(completedAt);
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalArgumentException("retryCount must be within [0, maxRetries]: " + retryCount);
        }
        this.retryCount = retryCount;
        this.errorMessage = errorMessage;
        this.result = JsonValues.normalize(result, "result");
    }

    public static JobBuilder builder(String name, String command) {
        return new JobBuilder(name, Command.parse(command));
    }

    public static JobBuilder builder(String name, Command command) {
        return new JobBuilder(name, command);
    }

    /**
     * A fresh job for the next occurrence of a recurring template: new id, new timestamps,
     * no retries used, copies of parameters, tags and metadata.
     */
    public Job copyForNextRun() {
        return new Job(name, command, parameters, priority, timeout, maxRetries, tags, metadata);
    }

    /* ================= lifecycle ================= */

    public synchronized void markStarted() {
        transitionTo(JobStatus.RUNNING);
        this.startedAt = now();
    }

    public synchronized void markCompleted(Map<String, Object> result) {
        Map<String, Object> normalized = JsonValues.normalize(result, "result");
        transitionTo(JobStatus.COMPLETED);
        this.completedAt = now();
        this.result = normalized;
    }

    public synchronized void markFailed(String errorMessage) {
        transitionTo(JobStatus.FAILED);
        this.completedAt = now();
        this.errorMessage = errorMessage;
    }

    public synchronized void markCancelled() {
        transitionTo(JobStatus.CANCELLED);
        this.completedAt = now();
    }

    public synchronized boolean canRetry() {
        return status == JobStatus.FAILED && retryCount < maxRetries;
    }

    /**
     * FAILED -> RETRY: uses one retry and clears the run timestamps.
     */
    public synchronized void markRetryPending() {
        if (!canRetry()) {
            throw new IllegalStateException("Job " + id + " cannot be retried (status=" + status
                    + ", retryCount=" + retryCount + ", maxRetries=" + maxRetries + ")");
        }
        transitionTo(JobStatus.RETRY);
        this.retryCount++;
        this.startedAt = null;
        this.completedAt = null;
    }

    /**
     * RETRY -> PENDING when the job re-enters the queue.
     */
    public synchronized void markPending() {
        transitionTo(JobStatus.PENDING);
    }

    public synchronized void scheduleAt(Instant time) {
        this.scheduledAt = truncate(Objects.requireNonNull(time, "time must not be null"));
    }

    public synchronized boolean isCancelled() {
        return status == JobStatus.CANCELLED;
    }

    public synchronized boolean isTerminal() {
        return status == JobStatus.COMPLETED
                || status == JobStatus.CANCELLED
                || (status == JobStatus.FAILED && retryCount >= maxRetries);
    }

    private void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + status + " -> " + next + " for job " + id);
        }
        this.status = next;
    }

    /* ================= accessors ================= */

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Command getCommand() {
        return command;
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Priority getPriority() {
        return priority;
    }

    public Integer getTimeout() {
        return timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized Instant getScheduledAt() {
        return scheduledAt;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized Map<String, Object> getResult() {
        return result == null ? null : Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", name=" + name + ", status=" + getStatus() + ", priority=" + priority + "}";
    }

    /* ================= helper ================= */

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Instant truncate(Instant t) {
        return t == null ? null : t.truncatedTo(ChronoUnit.MILLIS);
    }

    private static String requireNonBlank(String s, String field) {
        Objects.requireNonNull(s, field + " must not be null");
        if (s.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return s;
    }
}
