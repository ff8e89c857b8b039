package io.jobflow4j.scheduler;

import io.jobflow4j.config.JobflowProperties;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.queue.JobQueue;
import io.jobflow4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when a job enters the {@link JobQueue}.
 *
 * <p>One-shot jobs wait in a table until their {@code scheduledAt}; recurring definitions are
 * cloned into the queue on every cron occurrence. A single daemon thread checks both tables once
 * per tick. The queue is the only thing this class shares with the executor.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobQueue queue;
    private final Duration checkInterval;
    private final Duration errorBackoff;
    private final Duration stopTimeout;
    private final ZoneId zone;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Job> oneShot = new LinkedHashMap<>();
    private final Map<String, RecurringJob> recurring = new LinkedHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread schedulerThread;

    public JobScheduler(JobQueue queue, JobflowProperties.Scheduler props) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(props, "props must not be null");
        this.checkInterval = requirePositive(props.getCheckInterval(), "jobflow.scheduler.check-interval");
        this.errorBackoff = requirePositive(props.getErrorBackoff(), "jobflow.scheduler.error-backoff");
        this.stopTimeout = requirePositive(props.getStopTimeout(), "jobflow.scheduler.stop-timeout");
        this.zone = props.getTimezone() == null ? ZoneId.systemDefault() : ZoneId.of(props.getTimezone());
    }

    /**
     * Start the tick loop. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("jobflow scheduler already running");
            return;
        }
        schedulerThread = new Thread(this::schedulerLoop);
        schedulerThread.setName("jobflow.scheduler");
        schedulerThread.setDaemon(true);
        schedulerThread.start();
        log.info("jobflow scheduler started checkInterval={} zone={}", checkInterval, zone);
    }

    /**
     * Stop the tick loop and wait for it to exit. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        Thread t = schedulerThread;
        schedulerThread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("jobflow scheduler thread did not stop within {}", stopTimeout);
            }
        }
        log.info("jobflow scheduler stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Release {@code job} to the queue at or after {@code time}.
     */
    public String scheduleAt(Job job, Instant time) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(time, "time must not be null");
        lock.lock();
        try {
            job.scheduleAt(time);
            oneShot.put(job.getId(), job);
        } finally {
            lock.unlock();
        }
        log.info("jobflow job scheduled name={} id={} at={}", job.getName(), job.getId(), time);
        return job.getId();
    }

    public String scheduleAfter(Job job, Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return scheduleAt(job, nowInstant().plus(delay));
    }

    public String scheduleAfter(Job job, long delaySeconds) {
        return scheduleAfter(job, Duration.ofSeconds(delaySeconds));
    }

    /**
     * @param delay text such as "90", "30m" or "2 hours"
     * @throws io.jobflow4j.core.InvalidScheduleException if the text is malformed
     */
    public String scheduleAfter(Job job, String delay) {
        return scheduleAfter(job, IntervalParser.parseDuration(delay));
    }

    /**
     * Clone {@code template} into the queue on every occurrence of {@code cronExpression}.
     *
     * @throws io.jobflow4j.core.InvalidScheduleException if the expression is malformed
     */
    public String scheduleRecurring(Job template, String cronExpression) {
        Objects.requireNonNull(template, "template must not be null");
        Instant first;
        try {
            first = IntervalParser.nextFireTime(cronExpression, zone, nowInstant());
        } catch (RuntimeException e) {
            log.error("jobflow invalid cron expression cron={} msg={}", cronExpression, e.getMessage());
            throw e;
        }
        lock.lock();
        try {
            recurring.put(template.getId(), new RecurringJob(template, cronExpression, first));
        } finally {
            lock.unlock();
        }
        log.info("jobflow recurring job scheduled name={} id={} cron={} firstRun={}",
                template.getName(), template.getId(), cronExpression, first);
        return template.getId();
    }

    /**
     * Drop a one-shot or recurring entry. Clones already released are not affected.
     *
     * @return whether anything was removed
     */
    public boolean cancel(String jobId) {
        boolean cancelled = false;
        lock.lock();
        try {
            Job job = oneShot.remove(jobId);
            if (job != null) {
                if (job.getStatus().canTransitionTo(JobStatus.CANCELLED)) {
                    job.markCancelled();
                }
                cancelled = true;
            }
            if (recurring.remove(jobId) != null) {
                cancelled = true;
            }
        } finally {
            lock.unlock();
        }
        if (cancelled) {
            log.info("jobflow scheduled job cancelled id={}", jobId);
        }
        return cancelled;
    }

    public boolean contains(String jobId) {
        lock.lock();
        try {
            return oneShot.containsKey(jobId) || recurring.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    public List<Job> scheduledJobs() {
        lock.lock();
        try {
            return new ArrayList<>(oneShot.values());
        } finally {
            lock.unlock();
        }
    }

    public List<RecurringJob> recurringJobs() {
        lock.lock();
        try {
            return new ArrayList<>(recurring.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * One scheduling pass at {@code now}: release due one-shots, then fire due recurring entries.
     */
    void tick(Instant now) {
        releaseDueJobs(now);
        fireRecurringJobs(now);
    }

    // queue.add happens under the lock so cancel() always finds the job in the table or the queue
    private void releaseDueJobs(Instant now) {
        lock.lock();
        try {
            Iterator<Job> it = oneShot.values().iterator();
            while (it.hasNext()) {
                Job job = it.next();
                if (!job.getScheduledAt().isAfter(now)) {
                    it.remove();
                    queue.add(job);
                    log.info("jobflow scheduled job released name={} id={}", job.getName(), job.getId());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void fireRecurringJobs(Instant now) {
        lock.lock();
        try {
            Iterator<Map.Entry<String, RecurringJob>> it = recurring.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, RecurringJob> e = it.next();
                RecurringJob def = e.getValue();
                if (def.nextRun().isAfter(now)) {
                    continue;
                }

                Job run = def.template().copyForNextRun();
                queue.add(run);
                log.info("jobflow recurring job released name={} templateId={} id={}",
                        run.getName(), e.getKey(), run.getId());

                try {
                    e.setValue(def.withNextRun(IntervalParser.nextFireTime(def.cronExpression(), zone, now)));
                } catch (Exception ex) {
                    log.error("jobflow recurring job dropped id={} cron={} msg={}",
                            e.getKey(), def.cronExpression(), ex.getMessage(), ex);
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void schedulerLoop() {
        while (started.get()) {
            try {
                tick(nowInstant());
            } catch (Exception e) {
                log.error("jobflow scheduler tick failed msg={}", e.getMessage(), e);
                if (!sleep(errorBackoff)) {
                    break;
                }
                continue;
            }
            if (!sleep(checkInterval)) {
                break;
            }
        }
    }

    private boolean sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }
}
