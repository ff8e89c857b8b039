package io.jobflow4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.Jobflow;
import io.jobflow4j.config.JobflowProperties;
import io.jobflow4j.core.CancelResult;
import io.jobflow4j.core.DuplicateJobException;
import io.jobflow4j.core.HealthReport;
import io.jobflow4j.core.HealthStatus;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobBuilder;
import io.jobflow4j.core.JobFunctionRegistry;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;
import io.jobflow4j.core.SystemStatistics;
import io.jobflow4j.executor.TaskExecutor;
import io.jobflow4j.queue.JobQueue;
import io.jobflow4j.scheduler.JobScheduler;
import io.jobflow4j.store.JobStorage;
import io.jobflow4j.store.JobStore;
import io.jobflow4j.store.StorageStatistics;
import io.jobflow4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composes one queue, scheduler, executor and storage into a {@link Jobflow}.
 *
 * <p>Every component is owned by this instance, so several instances can live side by side
 * (in tests, for example). A daemon thread optionally purges old finished jobs.
 */
public class DefaultJobflow implements Jobflow {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobflow.class);

    static final double DEGRADED_FAILURE_RATIO = 0.5;

    private final JobflowProperties props;
    private final JobStorage storage;
    private final JobQueue queue;
    private final JobScheduler scheduler;
    private final TaskExecutor executor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Instant startTime;
    private Thread cleanupThread;

    public DefaultJobflow(JobflowProperties props,
                          JobStore store,
                          JobFunctionRegistry functions,
                          ObjectMapper objectMapper) {
        this(props, new JobStorage(store), new JobQueue(), functions, objectMapper);
    }

    private DefaultJobflow(JobflowProperties props,
                           JobStorage storage,
                           JobQueue queue,
                           JobFunctionRegistry functions,
                           ObjectMapper objectMapper) {
        this(props,
                storage,
                queue,
                new JobScheduler(queue, props.getScheduler()),
                new TaskExecutor(queue, storage, functions, objectMapper, props.getExecutor()));
    }

    public DefaultJobflow(JobflowProperties props,
                          JobStorage storage,
                          JobQueue queue,
                          JobScheduler scheduler,
                          TaskExecutor executor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /* ================= lifecycle ================= */

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("jobflow already running");
            return;
        }
        startTime = nowInstant();
        log.info("jobflow starting storage={} maxWorkers={} schedulerEnabled={}",
                storage.backend().getClass().getSimpleName(),
                props.getExecutor().getMaxWorkers(),
                props.getScheduler().isEnabled());

        executor.start();
        if (props.getScheduler().isEnabled()) {
            scheduler.start();
        }

        JobflowProperties.Cleanup cleanup = props.getCleanup();
        if (cleanup.isEnabled()) {
            if (cleanup.getInterval() == null || cleanup.getInterval().isZero() || cleanup.getInterval().isNegative()) {
                throw new IllegalArgumentException("jobflow.cleanup.interval must be a positive duration");
            }
            cleanupThread = new Thread(() -> cleanupLoop(cleanup.getInterval(), cleanup.getRetentionDays()));
            cleanupThread.setName("jobflow.cleanup");
            cleanupThread.setDaemon(true);
            cleanupThread.start();
        }
        log.info("jobflow started");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("jobflow stopping...");

        if (cleanupThread != null) {
            cleanupThread.interrupt();
            cleanupThread = null;
        }
        scheduler.stop();
        executor.stop();
        log.info("jobflow stopped");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /* ================= jobs ================= */

    @Override
    public String submit(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        rejectDuplicate(job.getId());
        storage.save(job);
        if (!queue.add(job)) {
            throw new DuplicateJobException(job.getId());
        }
        log.info("jobflow job submitted name={} id={} priority={}", job.getName(), job.getId(), job.getPriority());
        return job.getId();
    }

    @Override
    public JobBuilder create(String name, String command) {
        return Job.builder(name, command);
    }

    @Override
    public Job create(String name,
                      String command,
                      Map<String, Object> parameters,
                      Priority priority,
                      Integer timeout,
                      Integer maxRetries,
                      Set<String> tags,
                      Map<String, Object> metadata) {
        JobBuilder b = Job.builder(name, command).timeout(timeout);
        if (parameters != null) {
            b.parameters(parameters);
        }
        if (priority != null) {
            b.priority(priority);
        }
        if (maxRetries != null) {
            b.maxRetries(maxRetries);
        }
        if (tags != null) {
            b.tags(tags);
        }
        if (metadata != null) {
            b.metadata(metadata);
        }
        return b.build();
    }

    @Override
    public String scheduleAt(Job job, Instant time) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(time, "time must not be null");
        rejectDuplicate(job.getId());
        job.scheduleAt(time);
        storage.save(job);
        return scheduler.scheduleAt(job, time);
    }

    @Override
    public String scheduleAfter(Job job, long delaySeconds) {
        return scheduleAfter(job, Duration.ofSeconds(delaySeconds));
    }

    @Override
    public String scheduleAfter(Job job, Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return scheduleAt(job, nowInstant().plus(delay));
    }

    @Override
    public String scheduleAfter(Job job, String delay) {
        return scheduleAfter(job, IntervalParser.parseDuration(delay));
    }

    @Override
    public String scheduleRecurring(Job template, String cronExpression) {
        Objects.requireNonNull(template, "template must not be null");
        rejectDuplicate(template.getId());
        String id = scheduler.scheduleRecurring(template, cronExpression);
        storage.save(template);
        return id;
    }

    @Override
    public boolean cancel(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        boolean unscheduled = scheduler.cancel(jobId);
        CancelResult result = executor.cancel(jobId);

        boolean stored = false;
        if (!result.markedCancelled()) {
            Optional<Job> persisted = storage.get(jobId);
            if (persisted.isPresent()) {
                Job job = persisted.get();
                if (job.getStatus().canTransitionTo(JobStatus.CANCELLED)) {
                    job.markCancelled();
                    stored = storage.update(job);
                }
            }
        }

        boolean cancelled = unscheduled || result.hasEffect();
        if (cancelled || stored) {
            log.info("jobflow job cancel requested id={} unscheduled={} executor={} stored={}",
                    jobId, unscheduled, result, stored);
        } else {
            log.debug("jobflow cancel had no effect id={}", jobId);
        }
        return cancelled;
    }

    @Override
    public Optional<Job> get(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Optional<Job> persisted = storage.get(jobId);
        if (persisted.isPresent()) {
            return persisted;
        }
        // storage may have rejected the write; fall back to live state
        Optional<Job> running = executor.runningJob(jobId);
        if (running.isPresent()) {
            return running;
        }
        Optional<Job> queued = queue.get(jobId);
        if (queued.isPresent()) {
            return queued;
        }
        return scheduler.scheduledJobs().stream()
                .filter(j -> j.getId().equals(jobId))
                .findFirst();
    }

    @Override
    public List<Job> list(JobStatus status, Integer limit) {
        return storage.list(status, limit);
    }

    @Override
    public List<Job> list() {
        return storage.list();
    }

    @Override
    public List<String> runningIds() {
        return executor.runningJobIds();
    }

    /* ================= observability ================= */

    @Override
    public SystemStatistics statistics() {
        Instant st = startTime;
        double uptime = (st == null || !started.get())
                ? 0.0
                : Duration.between(st, nowInstant()).toMillis() / 1000.0;
        return new SystemStatistics(
                new SystemStatistics.SystemInfo(uptime, started.get(), st),
                storage.statistics(),
                queue.statistics(),
                executor.statistics()
        );
    }

    @Override
    public HealthReport health() {
        Map<String, Boolean> components = new LinkedHashMap<>();
        components.put("system", started.get());
        components.put("executor", executor.isRunning());
        if (props.getScheduler().isEnabled()) {
            components.put("scheduler", scheduler.isRunning());
        }
        components.put("storage", storage.healthCheck());

        HealthStatus status = HealthStatus.HEALTHY;
        String warning = null;
        if (components.containsValue(Boolean.FALSE)) {
            status = HealthStatus.UNHEALTHY;
        } else {
            StorageStatistics s = storage.statistics();
            if (s.totalJobs() > 0 && (double) s.failedJobs() / s.totalJobs() > DEGRADED_FAILURE_RATIO) {
                status = HealthStatus.DEGRADED;
                warning = String.format("High failure rate: %d of %d jobs failed", s.failedJobs(), s.totalJobs());
            }
        }
        return new HealthReport(status, nowInstant(), components, warning);
    }

    @Override
    public int cleanupOld(int olderThanDays) {
        return storage.cleanup(olderThanDays);
    }

    /* ================= accessors ================= */

    public JobStorage storage() {
        return storage;
    }

    public JobQueue queue() {
        return queue;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public TaskExecutor executor() {
        return executor;
    }

    /* ================= helper ================= */

    private void rejectDuplicate(String jobId) {
        if (queue.contains(jobId) || scheduler.contains(jobId) || executor.isRunning(jobId)) {
            throw new DuplicateJobException(jobId);
        }
    }

    private void cleanupLoop(Duration interval, int retentionDays) {
        while (started.get()) {
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                int deleted = cleanupOld(retentionDays);
                if (deleted > 0) {
                    log.info("jobflow periodic cleanup deleted={} retentionDays={}", deleted, retentionDays);
                }
            } catch (Exception e) {
                log.error("jobflow periodic cleanup failed msg={}", e.getMessage(), e);
            }
        }
    }

    /**
     * Utility: current time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }
}
