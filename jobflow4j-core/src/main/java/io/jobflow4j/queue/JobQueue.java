package io.jobflow4j.queue;

import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory holding area for jobs that are ready to run.
 *
 * <p>One heap per {@link Priority}; {@link #next()} scans URGENT down to LOW. Within a priority
 * entries leave in arrival order. Removal only drops the id from the lookup table, the heap entry
 * is discarded lazily when a scan reaches it.
 *
 * <p>Every operation runs under a single {@link ReentrantLock}, so the executor's dispatch loop,
 * the scheduler's release loop and API callers can share one instance.
 */
public class JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private static final Priority[] DISPATCH_ORDER = {Priority.URGENT, Priority.HIGH, Priority.NORMAL, Priority.LOW};

    private record Entry(Job job, long sequence) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Priority, PriorityQueue<Entry>> buckets = new EnumMap<>(Priority.class);
    private final Map<String, Entry> lookup = new HashMap<>();

    private long sequence;
    private long totalAdded;
    private long totalRetrieved;
    private long totalRemoved;
    private final Map<Priority, Long> addedByPriority = new EnumMap<>(Priority.class);

    public JobQueue() {
        for (Priority p : Priority.values()) {
            buckets.put(p, new PriorityQueue<>(Comparator.comparingLong(Entry::sequence)));
            addedByPriority.put(p, 0L);
        }
    }

    /**
     * Adds a job to its priority bucket. A job whose id is already queued is ignored.
     *
     * @return false if the id was already present
     */
    public boolean add(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            if (lookup.containsKey(job.getId())) {
                log.warn("jobflow queue rejected duplicate id={} name={}", job.getId(), job.getName());
                return false;
            }
            if (job.getStatus() == JobStatus.RETRY) {
                job.markPending();
            }

            Entry entry = new Entry(job, sequence++);
            buckets.get(job.getPriority()).offer(entry);
            lookup.put(job.getId(), entry);

            totalAdded++;
            addedByPriority.merge(job.getPriority(), 1L, Long::sum);
            log.debug("jobflow queue added name={} id={} priority={}", job.getName(), job.getId(), job.getPriority());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the highest-priority job, or empty if nothing is queued.
     */
    public Optional<Job> next() {
        lock.lock();
        try {
            for (Priority p : DISPATCH_ORDER) {
                PriorityQueue<Entry> heap = buckets.get(p);
                Entry e;
                while ((e = heap.poll()) != null) {
                    if (isLive(e)) {
                        lookup.remove(e.job().getId());
                        totalRetrieved++;
                        log.debug("jobflow queue retrieved name={} id={} priority={}", e.job().getName(), e.job().getId(), p);
                        return Optional.of(e.job());
                    }
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same order as {@link #next()} without removing.
     */
    public Optional<Job> peek() {
        lock.lock();
        try {
            for (Priority p : DISPATCH_ORDER) {
                PriorityQueue<Entry> heap = buckets.get(p);
                Entry e;
                while ((e = heap.peek()) != null) {
                    if (isLive(e)) {
                        return Optional.of(e.job());
                    }
                    heap.poll();
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String jobId) {
        lock.lock();
        try {
            Entry removed = lookup.remove(jobId);
            if (removed == null) {
                return false;
            }
            totalRemoved++;
            log.info("jobflow queue removed name={} id={}", removed.job().getName(), jobId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> get(String jobId) {
        lock.lock();
        try {
            Entry e = lookup.get(jobId);
            return e == null ? Optional.empty() : Optional.of(e.job());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String jobId) {
        lock.lock();
        try {
            return lookup.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    public List<Job> all() {
        return filter(j -> true);
    }

    public List<Job> byStatus(JobStatus status) {
        return filter(j -> j.getStatus() == status);
    }

    public List<Job> byTag(String tag) {
        return filter(j -> j.hasTag(tag));
    }

    public List<Job> byPriority(Priority priority) {
        return filter(j -> j.getPriority() == priority);
    }

    /**
     * Empties every bucket.
     */
    public void clear() {
        lock.lock();
        try {
            buckets.values().forEach(PriorityQueue::clear);
            lookup.clear();
            log.info("jobflow queue cleared all priorities");
        } finally {
            lock.unlock();
        }
    }

    public void clear(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        lock.lock();
        try {
            PriorityQueue<Entry> heap = buckets.get(priority);
            Entry e;
            while ((e = heap.poll()) != null) {
                lookup.remove(e.job().getId(), e);
            }
            log.info("jobflow queue cleared priority={}", priority);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return lookup.size();
        } finally {
            lock.unlock();
        }
    }

    public int size(Priority priority) {
        return byPriority(priority).size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public QueueStatistics statistics() {
        lock.lock();
        try {
            Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
            for (Priority p : Priority.values()) {
                byPriority.put(p, 0);
            }
            Map<JobStatus, Integer> byStatus = new EnumMap<>(JobStatus.class);
            for (JobStatus s : JobStatus.values()) {
                byStatus.put(s, 0);
            }
            for (Entry e : lookup.values()) {
                byPriority.merge(e.job().getPriority(), 1, Integer::sum);
                byStatus.merge(e.job().getStatus(), 1, Integer::sum);
            }
            return new QueueStatistics(
                    totalAdded,
                    totalRetrieved,
                    totalRemoved,
                    Map.copyOf(addedByPriority),
                    lookup.size(),
                    Map.copyOf(byPriority),
                    Map.copyOf(byStatus)
            );
        } finally {
            lock.unlock();
        }
    }

    // An entry is stale once its id was removed, or re-added as a newer entry.
    private boolean isLive(Entry e) {
        return lookup.get(e.job().getId()) == e;
    }

    private List<Job> filter(Predicate<Job> predicate) {
        lock.lock();
        try {
            List<Job> out = new ArrayList<>();
            for (Entry e : lookup.values()) {
                if (predicate.test(e.job())) {
                    out.add(e.job());
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }
}
