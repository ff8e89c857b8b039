package io.jobflow4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.core.Priority;
import io.jobflow4j.store.JobRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "jobflow4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        store = new MongoJobStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
    }

    private static Job jobWith(String id, JobStatus status, Instant createdAt) {
        return new Job(id, "job-" + id, Command.parse("echo " + id), Map.of(), Priority.NORMAL,
                null, 3, Set.of(), Map.of(), status, createdAt, null, null, null, 0, null, null);
    }

    @Test
    void saveThenGetShouldRoundTripEveryField() {
        Job job = Job.builder("etl", "python:etl.daily::load")
                .priority(Priority.LOW)
                .timeout(600)
                .parameter("tables", List.of("a", "b"))
                .parameter("options", Map.of("dryRun", false, "batch", 500))
                .tags(List.of("etl"))
                .metadata("team", "data")
                .metadata("runCount", 7L)
                .metadata("watermark", 1_767_225_600_000L)
                .build();
        job.markStarted();
        job.markCompleted(Map.of("result", Map.of("rows", 42L, "bytes", 9_000_000_000L), "module", "etl.daily", "function", "load"));

        store.save(job);

        Job loaded = store.get(job.getId()).orElseThrow();
        assertEquals(JobRecord.from(job), JobRecord.from(loaded));
    }

    @Test
    void saveShouldReplaceExistingDocument() {
        Job job = Job.builder("x", "true").build();
        store.save(job);
        job.markCancelled();
        store.save(job);

        assertEquals(1, store.count(null));
        assertEquals(JobStatus.CANCELLED, store.get(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void listShouldFilterOrderAndLimit() {
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        store.save(jobWith("a", JobStatus.PENDING, base));
        store.save(jobWith("b", JobStatus.COMPLETED, base.plusSeconds(1)));
        store.save(jobWith("c", JobStatus.PENDING, base.plusSeconds(2)));

        assertEquals(List.of("c", "b", "a"), ids(store.list(null, null)));
        assertEquals(List.of("c", "a"), ids(store.list(JobStatus.PENDING, null)));
        assertEquals(List.of("c"), ids(store.list(null, 1)));
        assertEquals(2, store.count(JobStatus.PENDING));
    }

    @Test
    void cleanupShouldOnlyRemoveOldFinishedJobs() {
        Instant old = Instant.parse("2024-06-01T00:00:00Z");
        store.save(jobWith("done", JobStatus.COMPLETED, old));
        store.save(jobWith("cancelled", JobStatus.CANCELLED, old));
        store.save(jobWith("pending", JobStatus.PENDING, old));
        store.save(jobWith("recent", JobStatus.FAILED, Instant.parse("2026-01-02T00:00:00Z")));

        assertEquals(2, store.cleanup(Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals(Set.of("pending", "recent"), Set.copyOf(ids(store.list(null, null))));
    }

    @Test
    void deleteAndHealthCheckShouldWork() {
        Job job = Job.builder("x", "true").build();
        store.save(job);

        assertTrue(store.healthCheck());
        assertTrue(store.delete(job.getId()));
        assertFalse(store.delete(job.getId()));
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::getId).collect(Collectors.toList());
    }
}
