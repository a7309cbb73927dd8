package io.jobargs4j.config;

import io.jobargs4j.internal.mongo.QueuedJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index definitions for the {@code queued_jobs} collection.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code jobargs.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { runAt: 1, lockUntil: 1 }
 *       <br/>Used by the runner to claim due, unlocked jobs in order.</li>
 *   <li><b>idx_name</b>: { name: 1 }
 *       <br/>Used to inspect jobs of one worker.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.queued_jobs.createIndex({ runAt: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.queued_jobs.createIndex({ name: 1 }, { name: "idx_name" });
 * </pre>
 */
public class JobArgsMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_NAME = "idx_name";

    private final MongoTemplate mongoTemplate;

    public JobArgsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(QueuedJobDocument.class);
        ops.ensureIndex(dueClaimIndex());
        ops.ensureIndex(nameIndex());
    }

    /**
     * Keys: runAt ASC, lockUntil ASC
     */
    public static Index dueClaimIndex() {
        return new Index()
                .on("runAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index nameIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .named(IDX_NAME);
    }
}
