package io.jobflow4j.queue;

import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobQueueTest {

    private static Job job(String name, Priority priority) {
        return Job.builder(name, "true").priority(priority).build();
    }

    @Test
    void urgentJobShouldBeServedBeforeEarlierLowJob() {
        JobQueue queue = new JobQueue();
        queue.add(job("A", Priority.LOW));
        queue.add(job("B", Priority.URGENT));

        assertEquals("B", queue.next().orElseThrow().getName());
        assertEquals("A", queue.next().orElseThrow().getName());
        assertTrue(queue.next().isEmpty());
    }

    @Test
    void nextShouldNeverReturnLowerPriorityThanAnyQueuedJob() {
        JobQueue queue = new JobQueue();
        Random random = new Random(42);
        Priority[] values = Priority.values();
        for (int i = 0; i < 200; i++) {
            queue.add(job("j" + i, values[random.nextInt(values.length)]));
        }

        while (!queue.isEmpty()) {
            Job next = queue.next().orElseThrow();
            for (Job remaining : queue.all()) {
                assertThat(next.getPriority().value()).isGreaterThanOrEqualTo(remaining.getPriority().value());
            }
        }
    }

    @Test
    void samePriorityShouldBeFifo() {
        JobQueue queue = new JobQueue();
        for (int i = 0; i < 10; i++) {
            queue.add(job("n" + i, Priority.NORMAL));
        }
        for (int i = 0; i < 10; i++) {
            assertEquals("n" + i, queue.next().orElseThrow().getName());
        }
    }

    @Test
    void duplicateIdShouldBeIgnored() {
        JobQueue queue = new JobQueue();
        Job j = job("dup", Priority.HIGH);

        assertTrue(queue.add(j));
        assertFalse(queue.add(j));
        assertEquals(1, queue.size());
    }

    @Test
    void removedJobShouldNotBeReturned() {
        JobQueue queue = new JobQueue();
        Job a = job("a", Priority.HIGH);
        Job b = job("b", Priority.HIGH);
        queue.add(a);
        queue.add(b);

        assertTrue(queue.remove(a.getId()));
        assertFalse(queue.remove(a.getId()));
        assertFalse(queue.contains(a.getId()));
        assertEquals(Optional.of(b), queue.peek());
        assertEquals(b, queue.next().orElseThrow());
        assertTrue(queue.isEmpty());
    }

    @Test
    void readdingAfterRemoveShouldWork() {
        JobQueue queue = new JobQueue();
        Job a = job("a", Priority.LOW);
        queue.add(a);
        queue.remove(a.getId());

        assertTrue(queue.add(a));
        assertEquals(a, queue.next().orElseThrow());
        assertTrue(queue.next().isEmpty());
    }

    @Test
    void retryingJobShouldBecomePendingWhenQueued() {
        JobQueue queue = new JobQueue();
        Job j = job("retry", Priority.NORMAL);
        j.markStarted();
        j.markFailed("boom");
        j.markRetryPending();

        queue.add(j);

        assertEquals(JobStatus.PENDING, j.getStatus());
        assertEquals(1, j.getRetryCount());
    }

    @Test
    void filtersAndClearShouldWork() {
        JobQueue queue = new JobQueue();
        Job tagged = Job.builder("t", "true").priority(Priority.HIGH).tag("reports").build();
        queue.add(tagged);
        queue.add(job("l1", Priority.LOW));
        queue.add(job("l2", Priority.LOW));

        assertEquals(List.of(tagged), queue.byTag("reports"));
        assertEquals(2, queue.byPriority(Priority.LOW).size());
        assertEquals(3, queue.byStatus(JobStatus.PENDING).size());
        assertEquals(2, queue.size(Priority.LOW));

        queue.clear(Priority.LOW);
        assertEquals(1, queue.size());
        queue.clear();
        assertTrue(queue.isEmpty());
    }

    @Test
    void statisticsShouldCountTraffic() {
        JobQueue queue = new JobQueue();
        Job a = job("a", Priority.URGENT);
        queue.add(a);
        queue.add(job("b", Priority.LOW));
        queue.add(job("c", Priority.LOW));
        queue.next();
        queue.remove(queue.all().get(0).getId());

        QueueStatistics stats = queue.statistics();
        assertEquals(3, stats.totalAdded());
        assertEquals(1, stats.totalRetrieved());
        assertEquals(1, stats.totalRemoved());
        assertEquals(1, stats.currentSize());
        assertEquals(2L, stats.addedByPriority().get(Priority.LOW));
        assertEquals(1, stats.priorityBreakdown().get(Priority.LOW));
        assertEquals(1, stats.statusBreakdown().get(JobStatus.PENDING));
    }

    @Test
    void concurrentConsumersShouldNeverShareAJob() throws InterruptedException {
        JobQueue queue = new JobQueue();
        for (int i = 0; i < 1000; i++) {
            queue.add(job("c" + i, Priority.values()[i % 4]));
        }

        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                try {
                    Optional<Job> next;
                    while ((next = queue.next()).isPresent()) {
                        if (!seen.add(next.get().getId())) {
                            duplicates.incrementAndGet();
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();
        assertEquals(0, duplicates.get());
        assertEquals(1000, seen.size());
        assertEquals(new ArrayList<Job>(), queue.all());
    }
}
