package io.jobflow4j;

import io.jobflow4j.core.HealthReport;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobBuilder;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;
import io.jobflow4j.core.SystemStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Main job API.
 *
 * <p>Jobs are built with {@link #create(String, String)}, then either submitted for immediate
 * execution or handed to the scheduler:
 * <pre>{@code
 * jobflow.start();
 *
 * Job job = jobflow.create("nightly-report", "shell:./report.sh {day}")
 *         .parameter("day", "monday")
 *         .priority(Priority.HIGH)
 *         .build();
 * jobflow.submit(job);
 *
 * jobflow.scheduleRecurring(jobflow.create("ping", "http://localhost/ping").build(), "0 * * * *");
 * jobflow.stop();
 * }</pre>
 */
public interface Jobflow {
    void start();

    void stop();

    boolean isRunning();

    /**
     * Persist and enqueue for immediate execution.
     *
     * @throws io.jobflow4j.core.DuplicateJobException if the id is already queued, scheduled or running
     */
    String submit(Job job);

    /**
     * Start building a job. Nothing is persisted until it is submitted or scheduled.
     *
     * @param command tagged command text, e.g. {@code shell:echo hi}, {@code python:mod::fn}, {@code http://host/x}
     */
    JobBuilder create(String name, String command);

    Job create(String name,
               String command,
               Map<String, Object> parameters,
               Priority priority,
               Integer timeout,
               Integer maxRetries,
               Set<String> tags,
               Map<String, Object> metadata);

    String scheduleAt(Job job, Instant time);

    String scheduleAfter(Job job, long delaySeconds);

    String scheduleAfter(Job job, Duration delay);

    /**
     * @param delay human duration text such as "90", "30m" or "2 hours"
     */
    String scheduleAfter(Job job, String delay);

    /**
     * Clone {@code template} into the queue on every cron occurrence.
     *
     * @throws io.jobflow4j.core.InvalidScheduleException if the cron expression is malformed
     */
    String scheduleRecurring(Job template, String cronExpression);

    /**
     * Cancel wherever the job currently is: scheduled, queued or running.
     *
     * <p>A stored job that is in none of those places (left over from an earlier process, for
     * example) is marked CANCELLED in storage if it has not finished, but that alone does not
     * count as a cancellation.
     *
     * @return whether the scheduler or the executor stopped the job
     */
    boolean cancel(String jobId);

    Optional<Job> get(String jobId);

    List<Job> list(JobStatus status, Integer limit);

    List<Job> list();

    List<String> runningIds();

    SystemStatistics statistics();

    HealthReport health();

    /**
     * Delete finished jobs created more than {@code olderThanDays} days ago.
     *
     * @return number of deleted jobs
     */
    int cleanupOld(int olderThanDays);
}
