package io.jobflow4j.internal.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.store.JobRecord;
import io.jobflow4j.store.JobStore;
import io.jobflow4j.store.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Flat-file job store: one {@code <id>.json} document per job in a single directory.
 *
 * <p>{@code list}, {@code count} and {@code cleanup} scan the directory. One lock per directory,
 * shared by every store instance in the JVM, serializes scans and writes; documents are written to a temp file and moved into place.
 * Unreadable documents are skipped with a warning.
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    private static final String SUFFIX = ".json";
    private static final ConcurrentMap<Path, ReentrantLock> DIRECTORY_LOCKS = new ConcurrentHashMap<>();

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock;

    public FileJobStore(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new JobStoreException("Failed to create job storage directory: " + directory, e);
        }
        this.lock = DIRECTORY_LOCKS.computeIfAbsent(canonical(directory), k -> new ReentrantLock());
    }

    ReentrantLock lock() {
        return lock;
    }

    private static Path canonical(Path directory) {
        try {
            return directory.toRealPath();
        } catch (IOException e) {
            return directory.toAbsolutePath().normalize();
        }
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Path target = fileFor(job.getId());
        lock.lock();
        try {
            Path tmp = Files.createTempFile(directory, job.getId(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), JobRecord.from(job));
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to write job " + job.getId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Job> get(String id) {
        Path file = fileFor(id);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(read(file));
        } catch (IOException e) {
            throw new JobStoreException("Failed to read job " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        Path file = fileFor(id);
        lock.lock();
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new JobStoreException("Failed to delete job " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Job> list(JobStatus status, Integer limit) {
        List<Job> jobs = new ArrayList<>();
        lock.lock();
        try {
            for (Path file : documents()) {
                Job job = readQuietly(file);
                if (job != null && (status == null || job.getStatus() == status)) {
                    jobs.add(job);
                }
            }
        } finally {
            lock.unlock();
        }

        jobs.sort(Comparator.comparing(Job::getCreatedAt).reversed());
        if (limit != null && jobs.size() > limit) {
            return new ArrayList<>(jobs.subList(0, limit));
        }
        return jobs;
    }

    @Override
    public long count(JobStatus status) {
        return list(status, null).size();
    }

    @Override
    public int cleanup(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int deleted = 0;
        lock.lock();
        try {
            for (Path file : documents()) {
                Job job = readQuietly(file);
                if (job == null) {
                    continue;
                }
                if (job.getCreatedAt().isBefore(cutoff) && job.getStatus().isCleanupEligible()) {
                    try {
                        Files.deleteIfExists(file);
                        deleted++;
                    } catch (IOException e) {
                        log.warn("jobflow file store could not delete file={} msg={}", file, e.getMessage());
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        return deleted;
    }

    @Override
    public boolean healthCheck() {
        return Files.isDirectory(directory) && Files.isWritable(directory);
    }

    /* ================= helper ================= */

    private Path fileFor(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new JobStoreException("Job id is not usable as a file name: " + id);
        }
        return directory.resolve(id + SUFFIX);
    }

    private List<Path> documents() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path p : stream) {
                files.add(p);
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to scan job storage directory: " + directory, e);
        }
        return files;
    }

    private Job read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), JobRecord.class).toJob();
    }

    private Job readQuietly(Path file) {
        try {
            return read(file);
        } catch (Exception e) {
            log.warn("jobflow file store skipped unreadable file={} msg={}", file, e.getMessage());
            return null;
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
