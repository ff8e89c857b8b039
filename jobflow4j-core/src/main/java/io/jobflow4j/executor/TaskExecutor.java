package io.jobflow4j.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.config.JobflowProperties;
import io.jobflow4j.core.CancelResult;
import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobFunctionRegistry;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.queue.JobQueue;
import io.jobflow4j.store.JobStorage;
import io.jobflow4j.utils.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Pulls jobs from the {@link JobQueue} and runs them on a bounded worker pool.
 *
 * <p>The dispatcher takes a worker permit before it dequeues, so a job stays in the queue (and
 * keeps its priority position) until a worker is free. Each run is persisted as RUNNING, then as
 * COMPLETED or FAILED. A failed job with retries left is put back on the queue at once.
 *
 * <p>Cancelling an in-flight job marks it CANCELLED and kills its subprocess, if any; whatever the
 * worker produces afterwards is discarded.
 */
public class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final JobQueue queue;
    private final JobStorage storage;
    private final JobFunctionRegistry functions;
    private final ObjectMapper objectMapper;

    private final int maxWorkers;
    private final Duration defaultTimeout;
    private final Duration shutdownTimeout;
    private final Duration pollInterval;
    private final Duration killGracePeriod;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;
    private Thread dispatcherThread;
    private Semaphore workerPermits;

    private ShellCommandRunner shellRunner;
    private FunctionCommandRunner functionRunner;
    private HttpCommandRunner httpRunner;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, InFlight> inFlight = new LinkedHashMap<>();
    private long jobsCompleted;
    private long jobsFailed;
    private long jobsCancelled;
    private long totalExecutionNanos;

    private static final class InFlight {
        private final Job job;
        private Future<?> future;
        private Process process;

        private InFlight(Job job) {
            this.job = job;
        }
    }

    public TaskExecutor(JobQueue queue,
                        JobStorage storage,
                        JobFunctionRegistry functions,
                        ObjectMapper objectMapper,
                        JobflowProperties.Executor props) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(props, "props must not be null");

        if (props.getMaxWorkers() <= 0) {
            throw new IllegalArgumentException("jobflow.executor.max-workers must be > 0");
        }
        this.maxWorkers = props.getMaxWorkers();
        this.defaultTimeout = requirePositive(props.getDefaultTimeout(), "jobflow.executor.default-timeout");
        this.shutdownTimeout = requirePositive(props.getShutdownTimeout(), "jobflow.executor.shutdown-timeout");
        this.pollInterval = requirePositive(props.getPollInterval(), "jobflow.executor.poll-interval");
        this.killGracePeriod = requirePositive(props.getKillGracePeriod(), "jobflow.executor.kill-grace-period");
    }

    /**
     * Start the dispatcher and the worker pool. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("jobflow executor already running");
            return;
        }

        shellRunner = new ShellCommandRunner();
        functionRunner = new FunctionCommandRunner(functions);
        httpRunner = new HttpCommandRunner(objectMapper, maxWorkers);
        workerPermits = new Semaphore(maxWorkers);

        AtomicInteger seq = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(maxWorkers, r -> {
            Thread t = new Thread(r);
            t.setName("jobflow.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("jobflow.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        log.info("jobflow executor started maxWorkers={} defaultTimeout={} functions={}",
                maxWorkers, defaultTimeout, functions.names());
    }

    /**
     * Stop dispatching, cancel everything in flight and wait up to the shutdown timeout for the
     * workers to exit. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("jobflow executor stopping...");

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                dispatcherThread.join(shutdownTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatcherThread = null;
        }

        for (String id : runningJobIds()) {
            cancel(id);
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("jobflow executor workers did not finish within {}", shutdownTimeout);
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (httpRunner != null) {
            try {
                httpRunner.close();
            } catch (IOException e) {
                log.warn("jobflow executor failed to close http client msg={}", e.getMessage());
            }
            httpRunner = null;
        }
        log.info("jobflow executor stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Cancel an in-flight job or drop it from the queue.
     */
    public CancelResult cancel(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        boolean futureCancelled = false;
        boolean markedCancelled = false;
        boolean dequeued = false;
        Job queuedJob = null;
        Process process = null;
        InFlight rec;

        // the dispatcher moves a job from the queue to inFlight under this lock,
        // so the job is seen in exactly one of them
        lock.lock();
        try {
            rec = inFlight.get(jobId);
            if (rec != null) {
                // not started yet: the worker body will never run, so clean up here
                if (rec.future != null && rec.future.cancel(false)) {
                    futureCancelled = true;
                    inFlight.remove(jobId);
                    workerPermits.release();
                }
                synchronized (rec.job) {
                    if (rec.job.getStatus().canTransitionTo(JobStatus.CANCELLED)) {
                        rec.job.markCancelled();
                        markedCancelled = true;
                    }
                }
                process = rec.process;
                if (futureCancelled || markedCancelled) {
                    jobsCancelled++;
                }
            } else {
                Optional<Job> queued = queue.get(jobId);
                dequeued = queue.remove(jobId);
                if (dequeued && queued.isPresent()) {
                    queuedJob = queued.get();
                    synchronized (queuedJob) {
                        if (queuedJob.getStatus().canTransitionTo(JobStatus.CANCELLED)) {
                            queuedJob.markCancelled();
                        } else {
                            queuedJob = null;
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        if (markedCancelled) {
            storage.update(rec.job);
        }
        if (queuedJob != null) {
            storage.update(queuedJob);
        }
        boolean processKilled = process != null && terminate(process);

        CancelResult result = new CancelResult(futureCancelled, processKilled, dequeued, markedCancelled);
        if (result.hasEffect()) {
            log.info("jobflow job cancelled id={} result={}", jobId, result);
        }
        return result;
    }

    public List<String> runningJobIds() {
        lock.lock();
        try {
            return new ArrayList<>(inFlight.keySet());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> runningJob(String jobId) {
        lock.lock();
        try {
            InFlight rec = inFlight.get(jobId);
            return rec == null ? Optional.empty() : Optional.of(rec.job);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(String jobId) {
        lock.lock();
        try {
            return inFlight.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    public ExecutorStatistics statistics() {
        lock.lock();
        try {
            return new ExecutorStatistics(
                    inFlight.size(),
                    jobsCompleted,
                    jobsFailed,
                    jobsCancelled,
                    totalExecutionNanos / 1_000_000_000.0,
                    maxWorkers,
                    started.get()
            );
        } finally {
            lock.unlock();
        }
    }

    /* ================= dispatch ================= */

    private void dispatchLoop() {
        while (started.get()) {
            try {
                if (!workerPermits.tryAcquire(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
                Optional<Job> next;
                lock.lock();
                try {
                    next = queue.next();
                    next.ifPresent(this::submitToWorker);
                } finally {
                    lock.unlock();
                }
                if (next.isEmpty()) {
                    workerPermits.release();
                    Thread.sleep(pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("jobflow dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    /**
     * Caller holds one worker permit, released when the run ends or is abandoned, and the lock.
     */
    private void submitToWorker(Job job) {
        if (job.getStatus() != JobStatus.PENDING) {
            log.warn("jobflow job skipped name={} id={} status={}", job.getName(), job.getId(), job.getStatus());
            workerPermits.release();
            return;
        }

        lock.lock();
        try {
            if (inFlight.containsKey(job.getId())) {
                log.warn("jobflow job already running id={}", job.getId());
                workerPermits.release();
                return;
            }
            InFlight rec = new InFlight(job);
            inFlight.put(job.getId(), rec);
            try {
                rec.future = workerPool.submit(() -> runJob(rec));
            } catch (RejectedExecutionException e) {
                inFlight.remove(job.getId());
                workerPermits.release();
                queue.add(job);
                log.warn("jobflow worker pool rejected job id={}; returned to queue", job.getId());
            }
        } finally {
            lock.unlock();
        }
    }

    private void runJob(InFlight rec) {
        Job job = rec.job;
        boolean requeue = false;
        long startNanos = System.nanoTime();
        try {
            synchronized (job) {
                if (job.getStatus() != JobStatus.PENDING) {
                    return;
                }
                job.markStarted();
            }
            storage.update(job);
            log.debug("jobflow job started name={} id={} attempt={}", job.getName(), job.getId(), job.getRetryCount() + 1);

            Map<String, Object> result;
            try {
                result = JsonValues.normalize(runCommand(job, rec), "result");
            } catch (JobExecutionException | RuntimeException e) {
                requeue = handleFailure(job, e);
                return;
            }

            synchronized (job) {
                if (job.isCancelled()) {
                    log.info("jobflow job result discarded after cancel name={} id={}", job.getName(), job.getId());
                    storage.update(job);
                    return;
                }
                job.markCompleted(result);
            }
            storage.update(job);
            countOutcome(true, startNanos);
            log.info("jobflow job completed name={} id={}", job.getName(), job.getId());
        } finally {
            boolean requeued = false;
            lock.lock();
            try {
                if (inFlight.get(job.getId()) == rec) {
                    inFlight.remove(job.getId());
                }
                // same critical section, so cancel() sees the retry either in flight or queued
                requeued = requeue && requeueUnlessCancelled(job);
            } finally {
                lock.unlock();
            }
            workerPermits.release();

            if (requeued) {
                log.info("jobflow job retry queued name={} id={} retry={}/{}",
                        job.getName(), job.getId(), job.getRetryCount(), job.getMaxRetries());
            }
        }
    }

    /**
     * @return whether the job should go back on the queue
     */
    private boolean handleFailure(Job job, Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        synchronized (job) {
            if (job.isCancelled()) {
                log.info("jobflow job failure discarded after cancel name={} id={}", job.getName(), job.getId());
                storage.update(job);
                return false;
            }
            job.markFailed(message);
        }
        storage.update(job);
        countOutcome(false, 0);

        if (e instanceof JobExecutionException) {
            log.error("jobflow job failed name={} id={} msg={}", job.getName(), job.getId(), message);
        } else {
            log.error("jobflow job failed name={} id={} msg={}", job.getName(), job.getId(), message, e);
        }

        if (!job.canRetry()) {
            if (job.getMaxRetries() > 0) {
                log.warn("jobflow job reached max retries name={} id={} retries={}",
                        job.getName(), job.getId(), job.getRetryCount());
            }
            return false;
        }
        job.markRetryPending();
        storage.update(job);
        return true;
    }

    private boolean requeueUnlessCancelled(Job job) {
        synchronized (job) {
            return !job.isCancelled() && queue.add(job);
        }
    }

    private Map<String, Object> runCommand(Job job, InFlight rec) throws JobExecutionException {
        Duration timeout = job.getTimeout() == null ? defaultTimeout : Duration.ofSeconds(job.getTimeout());
        RunContext context = new RunContext(timeout, p -> attachProcess(rec, p));

        Command command = job.getCommand();
        if (command instanceof Command.Shell shell) {
            return shellRunner.run(shell, job, context);
        }
        if (command instanceof Command.FunctionCall call) {
            return functionRunner.run(call, job, context);
        }
        if (command instanceof Command.Http http) {
            return httpRunner.run(http, job, context);
        }
        throw new JobExecutionException("Unsupported command: " + command);
    }

    private void attachProcess(InFlight rec, Process process) {
        boolean cancelled;
        lock.lock();
        try {
            rec.process = process;
            cancelled = rec.job.isCancelled();
        } finally {
            lock.unlock();
        }
        // cancel() ran before the process existed
        if (cancelled) {
            terminate(process);
        }
    }

    /**
     * Ask the process tree to exit, then force it after the grace period.
     */
    private boolean terminate(Process process) {
        if (!process.isAlive()) {
            return false;
        }
        List<ProcessHandle> children = process.descendants().collect(Collectors.toList());
        process.destroy();
        children.forEach(ProcessHandle::destroy);
        try {
            if (!process.waitFor(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                children.forEach(ProcessHandle::destroyForcibly);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            children.forEach(ProcessHandle::destroyForcibly);
        }
        return true;
    }

    private void countOutcome(boolean success, long startNanos) {
        lock.lock();
        try {
            if (success) {
                jobsCompleted++;
                totalExecutionNanos += System.nanoTime() - startNanos;
            } else {
                jobsFailed++;
            }
        } finally {
            lock.unlock();
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }
}
