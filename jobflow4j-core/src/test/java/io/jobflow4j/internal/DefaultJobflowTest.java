package io.jobflow4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.config.JobflowProperties;
import io.jobflow4j.core.Command;
import io.jobflow4j.core.DuplicateJobException;
import io.jobflow4j.core.HealthReport;
import io.jobflow4j.core.HealthStatus;
import io.jobflow4j.core.InvalidScheduleException;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobFunctionRegistry;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;
import io.jobflow4j.core.SystemStatistics;
import io.jobflow4j.executor.TaskExecutor;
import io.jobflow4j.internal.file.FileJobStore;
import io.jobflow4j.queue.JobQueue;
import io.jobflow4j.scheduler.JobScheduler;
import io.jobflow4j.store.JobStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class DefaultJobflowTest {

    @TempDir
    Path dir;

    private DefaultJobflow jobflow;

    private static JobflowProperties testProperties() {
        JobflowProperties props = new JobflowProperties();
        props.getExecutor().setMaxWorkers(2);
        props.getExecutor().setPollInterval(Duration.ofMillis(20));
        props.getScheduler().setCheckInterval(Duration.ofMillis(100));
        props.getCleanup().setEnabled(false);
        return props;
    }

    @BeforeEach
    void setUp() {
        JobflowProperties props = testProperties();
        jobflow = new DefaultJobflow(props,
                new FileJobStore(dir.resolve("jobs"), new ObjectMapper()),
                JobFunctionRegistry.empty(),
                new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        jobflow.stop();
    }

    @Test
    void urgentJobShouldBeDequeuedBeforeEarlierLowJob() {
        jobflow.submit(jobflow.create("A", "shell:true").priority(Priority.LOW).build());
        jobflow.submit(jobflow.create("B", "shell:true").priority(Priority.URGENT).build());

        assertEquals("B", jobflow.queue().next().orElseThrow().getName());
    }

    @Test
    void alwaysFailingJobShouldEndFailedWithRetriesUsed() throws InterruptedException {
        jobflow.start();
        String id = jobflow.submit(jobflow.create("flaky", "shell:exit 7").maxRetries(2).build());

        assertTrue(waitUntil(10, TimeUnit.SECONDS, () -> jobflow.get(id)
                .filter(j -> j.getStatus() == JobStatus.FAILED && j.getRetryCount() == 2)
                .isPresent()));
        assertTrue(jobflow.get(id).orElseThrow().getErrorMessage().contains("code 7"));
    }

    @Test
    void oneShotJobShouldBeReleasedAfterItsDelay() throws InterruptedException {
        jobflow.start();
        Job job = jobflow.create("later", "shell:true").build();

        jobflow.scheduleAfter(job, 2);

        assertFalse(jobflow.queue().contains(job.getId()));
        assertEquals(JobStatus.PENDING, jobflow.get(job.getId()).orElseThrow().getStatus());
        Thread.sleep(3000);
        assertTrue(jobflow.queue().contains(job.getId())
                || jobflow.get(job.getId()).orElseThrow().getStatus() != JobStatus.PENDING);
    }

    @Test
    void submittingTheSameJobTwiceShouldBeRejected() {
        Job job = jobflow.create("once", "shell:true").build();
        jobflow.submit(job);

        DuplicateJobException e = assertThrows(DuplicateJobException.class, () -> jobflow.submit(job));
        assertEquals(job.getId(), e.jobId());
        assertThrows(DuplicateJobException.class, () -> jobflow.scheduleAfter(job, 10));
    }

    @Test
    void cancelShouldReachScheduledQueuedAndStoredJobs() {
        Job scheduled = jobflow.create("scheduled", "shell:true").build();
        Job queued = jobflow.create("queued", "shell:true").build();
        jobflow.scheduleAt(scheduled, Instant.now().plus(Duration.ofHours(1)));
        jobflow.submit(queued);

        assertTrue(jobflow.cancel(scheduled.getId()));
        assertTrue(jobflow.cancel(queued.getId()));
        assertFalse(jobflow.cancel("no-such-job"));

        assertEquals(JobStatus.CANCELLED, jobflow.get(scheduled.getId()).orElseThrow().getStatus());
        assertEquals(JobStatus.CANCELLED, jobflow.get(queued.getId()).orElseThrow().getStatus());
        assertTrue(jobflow.queue().isEmpty());
        assertFalse(jobflow.scheduler().contains(scheduled.getId()));
    }

    @Test
    void cancelDuringDispatchHandOffShouldStopTheJob() throws InterruptedException {
        CountDownLatch taken = new CountDownLatch(1);
        JobQueue slowHandOff = new JobQueue() {
            @Override
            public Optional<Job> next() {
                Optional<Job> job = super.next();
                if (job.isPresent()) {
                    taken.countDown();
                    pause(300);
                }
                return job;
            }
        };
        JobflowProperties props = testProperties();
        JobStorage storage = new JobStorage(new FileJobStore(dir.resolve("handoff"), new ObjectMapper()));
        DefaultJobflow flow = new DefaultJobflow(props, storage, slowHandOff,
                new JobScheduler(slowHandOff, props.getScheduler()),
                new TaskExecutor(slowHandOff, storage, JobFunctionRegistry.empty(), new ObjectMapper(), props.getExecutor()));
        try {
            flow.start();
            String id = flow.submit(flow.create("handoff", "shell:echo ran").build());
            assertTrue(taken.await(5, TimeUnit.SECONDS));

            assertTrue(flow.cancel(id));

            assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> flow.runningIds().isEmpty()));
            Thread.sleep(200);
            assertEquals(JobStatus.CANCELLED, flow.get(id).orElseThrow().getStatus());
            assertEquals(0, flow.statistics().executor().jobsCompleted());
        } finally {
            flow.stop();
        }
    }

    @Test
    void cancellingJobKnownOnlyToStorageShouldMarkItButReportNoEffect() {
        Job orphan = jobflow.create("orphan", "shell:true").build();
        jobflow.storage().save(orphan);

        assertFalse(jobflow.cancel(orphan.getId()));
        assertEquals(JobStatus.CANCELLED, jobflow.get(orphan.getId()).orElseThrow().getStatus());
    }

    @Test
    void cancellingFinishedJobShouldHaveNoEffect() throws InterruptedException {
        jobflow.start();
        String id = jobflow.submit(jobflow.create("quick", "shell:true").build());
        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> jobflow.get(id).map(Job::getStatus).orElse(null) == JobStatus.COMPLETED));

        assertFalse(jobflow.cancel(id));
        assertEquals(JobStatus.COMPLETED, jobflow.get(id).orElseThrow().getStatus());
    }

    @Test
    void cleanupWithZeroDaysShouldRemoveOnlyFinishedJobs() throws InterruptedException {
        Job pending = jobflow.create("pending", "shell:true").build();
        Job running = jobflow.create("running", "shell:true").build();
        running.markStarted();
        Job done = jobflow.create("done", "shell:true").build();
        done.markStarted();
        done.markCompleted(Map.of());
        Job cancelled = jobflow.create("cancelled", "shell:true").build();
        cancelled.markCancelled();
        for (Job j : List.of(pending, running, done, cancelled)) {
            jobflow.storage().save(j);
        }
        Thread.sleep(5);

        assertEquals(2, jobflow.cleanupOld(0));
        assertEquals(Set.of(pending.getId(), running.getId()),
                Set.copyOf(jobflow.list().stream().map(Job::getId).toList()));
    }

    @Test
    void healthShouldReflectComponentsAndFailureRatio() {
        HealthReport stopped = jobflow.health();
        assertEquals(HealthStatus.UNHEALTHY, stopped.status());
        assertFalse(stopped.components().get("system"));

        jobflow.start();
        HealthReport healthy = jobflow.health();
        assertEquals(HealthStatus.HEALTHY, healthy.status());
        assertEquals(Map.of("system", true, "executor", true, "scheduler", true, "storage", true), healthy.components());
        assertNull(healthy.warning());

        for (int i = 0; i < 2; i++) {
            Job failed = jobflow.create("failed-" + i, "shell:false").maxRetries(0).build();
            failed.markStarted();
            failed.markFailed("boom");
            jobflow.storage().save(failed);
        }
        Job ok = jobflow.create("ok", "shell:true").build();
        jobflow.storage().save(ok);

        HealthReport degraded = jobflow.health();
        assertEquals(HealthStatus.DEGRADED, degraded.status());
        assertNotNull(degraded.warning());
    }

    @Test
    void statisticsShouldCombineAllComponents() {
        jobflow.submit(jobflow.create("a", "shell:true").priority(Priority.HIGH).build());

        SystemStatistics stats = jobflow.statistics();

        assertFalse(stats.system().running());
        assertEquals(1, stats.storage().totalJobs());
        assertEquals(1, stats.storage().pendingJobs());
        assertEquals(1, stats.queue().currentSize());
        assertEquals(1, stats.queue().priorityBreakdown().get(Priority.HIGH));
        assertEquals(2, stats.executor().maxWorkers());

        jobflow.start();
        assertTrue(jobflow.statistics().system().running());
        assertNotNull(jobflow.statistics().system().startTime());
    }

    @Test
    void createShouldBuildWithoutSideEffects() {
        Job job = jobflow.create("full", "python:etl::load", Map.of("date", "2026-01-01"), Priority.HIGH,
                120, 5, Set.of("etl"), Map.of("owner", "data"));

        assertEquals(new Command.FunctionCall("etl", "load"), job.getCommand());
        assertEquals(Priority.HIGH, job.getPriority());
        assertEquals(120, job.getTimeout());
        assertEquals(5, job.getMaxRetries());
        assertTrue(job.hasTag("etl"));
        assertTrue(jobflow.get(job.getId()).isEmpty());

        Job defaults = jobflow.create("defaults", "true", null, null, null, null, null, null);
        assertEquals(Priority.NORMAL, defaults.getPriority());
        assertEquals(Job.DEFAULT_MAX_RETRIES, defaults.getMaxRetries());
    }

    @Test
    void invalidCronShouldBeRejectedAndNotPersisted() {
        Job template = jobflow.create("bad", "shell:true").build();

        assertThrows(InvalidScheduleException.class, () -> jobflow.scheduleRecurring(template, "every day"));
        assertTrue(jobflow.get(template.getId()).isEmpty());
    }

    @Test
    void recurringTemplateShouldBePersistedAndListed() {
        Job template = jobflow.create("cron", "shell:true").build();

        String id = jobflow.scheduleRecurring(template, "0 3 * * *");

        assertEquals(template.getId(), id);
        assertTrue(jobflow.get(id).isPresent());
        assertEquals(1, jobflow.scheduler().recurringJobs().size());
        assertEquals(1, jobflow.list(JobStatus.PENDING, 10).size());
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
