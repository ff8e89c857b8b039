package io.jobflow4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.store.JobRecord;
import io.jobflow4j.store.JobStore;
import io.jobflow4j.store.JobStoreException;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MongoDB job store: one {@link JobDocument} per job in the {@code jobs} collection, keyed by job id.
 *
 * <p>Nested parameter, metadata and result values are normalized through Jackson on the way out
 * so they come back as plain maps and lists.
 */
public class MongoJobStore implements JobStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            mongoTemplate.save(toDocument(JobRecord.from(job)));
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to save job " + job.getId(), e);
        }
    }

    @Override
    public Optional<Job> get(String id) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(this::toJob);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load job " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        Query q = new Query(Criteria.where("_id").is(id));
        try {
            return mongoTemplate.remove(q, JobDocument.class).getDeletedCount() > 0;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to delete job " + id, e);
        }
    }

    @Override
    public List<Job> list(JobStatus status, Integer limit) {
        Query q = statusQuery(status).with(Sort.by(Sort.Direction.DESC, "createdAt"));
        if (limit != null) {
            q.limit(limit);
        }
        try {
            return mongoTemplate.find(q, JobDocument.class).stream()
                    .map(this::toJob)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to list jobs", e);
        }
    }

    @Override
    public long count(JobStatus status) {
        try {
            return mongoTemplate.count(statusQuery(status), JobDocument.class);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    @Override
    public int cleanup(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        List<String> statuses = JobStatus.cleanupEligible().stream().map(Enum::name).collect(Collectors.toList());
        Query q = new Query(Criteria.where("createdAt").lt(cutoff).and("status").in(statuses));
        try {
            return (int) mongoTemplate.remove(q, JobDocument.class).getDeletedCount();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to clean up jobs", e);
        }
    }

    @Override
    public boolean healthCheck() {
        Document reply = mongoTemplate.executeCommand(new Document("ping", 1));
        Object ok = reply.get("ok");
        return ok instanceof Number n && n.doubleValue() == 1.0;
    }

    /* ================= mapping ================= */

    private static Query statusQuery(JobStatus status) {
        return status == null ? new Query() : new Query(Criteria.where("status").is(status.name()));
    }

    private static JobDocument toDocument(JobRecord r) {
        JobDocument doc = new JobDocument();
        doc.setId(r.id());
        doc.setName(r.name());
        doc.setCommand(r.command());
        doc.setParameters(r.parameters());
        doc.setStatus(r.status());
        doc.setPriority(r.priority());
        doc.setCreatedAt(Instant.ofEpochMilli(r.createdAt()));
        doc.setScheduledAt(toInstant(r.scheduledAt()));
        doc.setStartedAt(toInstant(r.startedAt()));
        doc.setCompletedAt(toInstant(r.completedAt()));
        doc.setRetryCount(r.retryCount());
        doc.setMaxRetries(r.maxRetries());
        doc.setTimeout(r.timeout());
        doc.setTags(r.tags());
        doc.setMetadata(r.metadata());
        doc.setErrorMessage(r.errorMessage());
        doc.setResult(r.result());
        return doc;
    }

    private Job toJob(JobDocument doc) {
        return new JobRecord(
                doc.getId(),
                doc.getName(),
                doc.getCommand(),
                normalize(doc.getParameters()),
                doc.getStatus(),
                doc.getPriority(),
                doc.getCreatedAt().toEpochMilli(),
                toMillis(doc.getScheduledAt()),
                toMillis(doc.getStartedAt()),
                toMillis(doc.getCompletedAt()),
                doc.getRetryCount(),
                doc.getMaxRetries(),
                doc.getTimeout(),
                doc.getTags(),
                normalize(doc.getMetadata()),
                doc.getErrorMessage(),
                normalize(doc.getResult())
        ).toJob();
    }

    private Map<String, Object> normalize(Map<String, Object> raw) {
        return raw == null ? null : objectMapper.convertValue(raw, MAP_TYPE);
    }

    private static Instant toInstant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
