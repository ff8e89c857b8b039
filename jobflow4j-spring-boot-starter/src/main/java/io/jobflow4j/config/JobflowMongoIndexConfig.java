package io.jobflow4j.config;

import io.jobflow4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;

/**
 * MongoDB index definitions for the {@code jobs} collection.
 *
 * <p>Indexes are <b>not</b> created automatically unless
 * {@code jobflow.storage.ensure-indexes-on-startup=true}; production deployments usually manage
 * them through migrations:
 * <pre>
 * db.jobs.createIndex({ status: 1, createdAt: -1 }, { name: "idx_status_created" });
 * db.jobs.createIndex({ createdAt: -1 }, { name: "idx_created" });
 * db.jobs.createIndex({ priority: -1 }, { name: "idx_priority" });
 * db.jobs.createIndex({ scheduledAt: 1 }, { name: "idx_scheduled" });
 * </pre>
 */
public class JobflowMongoIndexConfig {

    public static final String IDX_STATUS_CREATED = "idx_status_created";
    public static final String IDX_CREATED = "idx_created";
    public static final String IDX_PRIORITY = "idx_priority";
    public static final String IDX_SCHEDULED = "idx_scheduled";

    private final MongoTemplate mongoTemplate;

    public JobflowMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(JobDocument.class);
        for (Index index : requiredIndexes()) {
            ops.ensureIndex(index);
        }
    }

    public static List<Index> requiredIndexes() {
        return List.of(statusCreatedIndex(), createdIndex(), priorityIndex(), scheduledIndex());
    }

    /**
     * Serves {@code list(status, limit)}, {@code count(status)} and cleanup.
     */
    public static Index statusCreatedIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_STATUS_CREATED);
    }

    public static Index createdIndex() {
        return new Index().on("createdAt", Sort.Direction.DESC).named(IDX_CREATED);
    }

    public static Index priorityIndex() {
        return new Index().on("priority", Sort.Direction.DESC).named(IDX_PRIORITY);
    }

    public static Index scheduledIndex() {
        return new Index().on("scheduledAt", Sort.Direction.ASC).named(IDX_SCHEDULED);
    }
}
