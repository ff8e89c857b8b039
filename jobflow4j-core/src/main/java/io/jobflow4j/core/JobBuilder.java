package io.jobflow4j.core;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fluent builder for a new {@link Job}. {@link #build()} has no side effects; submitting or
 * scheduling the result is up to the caller.
 */
public class JobBuilder {

    private final String name;
    private final Command command;

    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final Set<String> tags = new LinkedHashSet<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private Priority priority = Priority.NORMAL;
    private Integer timeout;
    private int maxRetries = Job.DEFAULT_MAX_RETRIES;

    JobBuilder(String name, Command command) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.command = Objects.requireNonNull(command, "command must not be null");
    }

    public JobBuilder parameters(Map<String, Object> parameters) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        this.parameters.putAll(parameters);
        return this;
    }

    public JobBuilder parameter(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        this.parameters.put(key, value);
        return this;
    }

    public JobBuilder priority(Priority priority) {
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        return this;
    }

    /**
     * Timeout in seconds; {@code null} means the executor default.
     */
    public JobBuilder timeout(Integer seconds) {
        if (seconds != null && seconds <= 0) {
            throw new IllegalArgumentException("timeout must be a positive number of seconds");
        }
        this.timeout = seconds;
        return this;
    }

    public JobBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public JobBuilder tag(String tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        this.tags.add(tag);
        return this;
    }

    public JobBuilder tags(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        tags.forEach(this::tag);
        return this;
    }

    public JobBuilder metadata(Map<String, Object> metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        this.metadata.putAll(metadata);
        return this;
    }

    public JobBuilder metadata(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        this.metadata.put(key, value);
        return this;
    }

    public Job build() {
        return new Job(name, command, parameters, priority, timeout, maxRetries, tags, metadata);
    }
}
