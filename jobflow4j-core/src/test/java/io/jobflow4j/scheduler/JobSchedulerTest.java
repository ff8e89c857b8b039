package io.jobflow4j.scheduler;

import io.jobflow4j.config.JobflowProperties;
import io.jobflow4j.core.InvalidScheduleException;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.queue.JobQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobSchedulerTest {

    private JobQueue queue;
    private Instant now;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        queue = new JobQueue();
        now = Instant.parse("2026-03-01T12:00:03Z");
        JobflowProperties.Scheduler props = new JobflowProperties.Scheduler();
        props.setTimezone("UTC");
        scheduler = new JobScheduler(queue, props) {
            @Override
            protected Instant nowInstant() {
                return now;
            }
        };
    }

    @Test
    void oneShotJobShouldWaitUntilItsTime() {
        Job job = Job.builder("later", "true").build();
        scheduler.scheduleAfter(job, 2);

        scheduler.tick(now);
        assertFalse(queue.contains(job.getId()));
        assertTrue(scheduler.contains(job.getId()));

        scheduler.tick(now.plusSeconds(1));
        assertFalse(queue.contains(job.getId()));

        scheduler.tick(now.plusSeconds(2));
        assertTrue(queue.contains(job.getId()));
        assertFalse(scheduler.contains(job.getId()));
    }

    @Test
    void scheduleAfterShouldAcceptHumanDurations() {
        Job job = Job.builder("later", "true").build();
        scheduler.scheduleAfter(job, "2m");

        assertEquals(now.plus(Duration.ofMinutes(2)), job.getScheduledAt());
        assertThrows(InvalidScheduleException.class,
                () -> scheduler.scheduleAfter(Job.builder("x", "true").build(), "whenever"));
    }

    @Test
    void everyTenSecondsCronShouldFireThreeOrFourTimesIn35Seconds() {
        Job template = Job.builder("tick", "true").build();
        scheduler.scheduleRecurring(template, "*/10 * * * * *");

        Instant t = now;
        for (int i = 0; i < 35; i++) {
            t = t.plusSeconds(1);
            scheduler.tick(t);
        }

        int fired = queue.size();
        assertTrue(fired == 3 || fired == 4, "fired=" + fired);
        assertFalse(queue.contains(template.getId()));
        queue.all().forEach(j -> assertNotEquals(template.getId(), j.getId()));
    }

    @Test
    void missedOccurrencesShouldNotBeCaughtUp() {
        Job template = Job.builder("tick", "true").build();
        scheduler.scheduleRecurring(template, "*/10 * * * * *");

        scheduler.tick(now.plusSeconds(120));
        assertEquals(1, queue.size());

        RecurringJob def = scheduler.recurringJobs().get(0);
        assertEquals(Instant.parse("2026-03-01T12:02:10Z"), def.nextRun());
    }

    @Test
    void invalidCronShouldBeRejectedUpFront() {
        Job template = Job.builder("bad", "true").build();

        assertThrows(InvalidScheduleException.class, () -> scheduler.scheduleRecurring(template, "61 * * * *"));
        assertTrue(scheduler.recurringJobs().isEmpty());
    }

    @Test
    void cancelShouldDropScheduledEntries() {
        Job oneShot = Job.builder("once", "true").build();
        Job template = Job.builder("cron", "true").build();
        scheduler.scheduleAfter(oneShot, 5);
        scheduler.scheduleRecurring(template, "* * * * *");

        assertTrue(scheduler.cancel(oneShot.getId()));
        assertTrue(scheduler.cancel(template.getId()));
        assertFalse(scheduler.cancel("missing"));
        assertEquals(JobStatus.CANCELLED, oneShot.getStatus());

        scheduler.tick(now.plus(Duration.ofHours(1)));
        assertTrue(queue.isEmpty());
    }

    @Test
    void backgroundLoopShouldReleaseDueJobs() throws InterruptedException {
        JobflowProperties.Scheduler props = new JobflowProperties.Scheduler();
        props.setCheckInterval(Duration.ofMillis(50));
        JobScheduler live = new JobScheduler(queue, props);
        Job job = Job.builder("soon", "true").build();
        live.scheduleAt(job, Instant.now().minusMillis(1));

        live.start();
        try {
            assertTrue(live.isRunning());
            assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> queue.contains(job.getId())));
        } finally {
            live.stop();
        }
        assertFalse(live.isRunning());
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
