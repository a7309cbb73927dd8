package io.jobargs4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB persistence layer for queued jobs.
 *
 * <p>Every write-back after a run is guarded by {@code lockedBy}, so a worker whose lock expired
 * cannot overwrite the state written by the worker that re-claimed the job.
 */
public class MongoJobStore {

    static final int MAX_ERROR_LENGTH = 1024;

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Insert a new job.
     *
     * @return the generated document id
     */
    public String insert(String name, String payloadJson, Instant enqueuedAt, Instant runAt) {
        if (isBlank(name)) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
        Objects.requireNonNull(runAt, "runAt must not be null");

        QueuedJobDocument doc = new QueuedJobDocument();
        doc.setName(name);
        doc.setPayload(payloadJson);
        doc.setEnqueuedAt(enqueuedAt);
        doc.setRunAt(runAt);
        return mongoTemplate.insert(doc).getId();
    }

    public QueuedJobDocument findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return mongoTemplate.findById(id, QueuedJobDocument.class);
    }

    /**
     * Hard delete job by document id.
     *
     * @return deleted count (0 or 1 normally)
     */
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, QueuedJobDocument.class).getDeletedCount();
    }

    /**
     * Atomically claims (locks) at most {@code batchSize} due jobs.
     *
     * <p>A job is due when {@code runAt <= now} and it is not locked, or its lock has expired.
     * Each claim is a single {@code findAndModify}, so two runners never claim the same job.
     */
    public List<QueuedJobDocument> claimDueJobs(Instant now, int batchSize, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query query = new Query(
                Criteria.where("runAt").ne(null).lte(now)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        );
        query.with(Sort.by(Sort.Order.asc("runAt")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<QueuedJobDocument> claimed = new ArrayList<>(Math.min(batchSize, 64));
        for (int i = 0; i < batchSize; i++) {
            QueuedJobDocument doc = mongoTemplate.findAndModify(query, lockUpdate, options, QueuedJobDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(doc);
        }
        return claimed;
    }

    /**
     * Keep a finished job for inspection: release the lock and take it off the schedule.
     */
    public UpdateResult markSuccess(String id, String workerId, Instant startedAt, Instant finishedAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        Update u = new Update()
                .set("lastRunAt", startedAt != null ? startedAt : finishedAt)
                .set("lastFinishedAt", finishedAt)
                .unset("runAt")
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");

        return mongoTemplate.updateFirst(lockedBy(id, workerId), u, QueuedJobDocument.class);
    }

    /**
     * Record a failed run.
     *
     * @param nextRunAtOrNull when to retry, or null to park the job
     */
    public UpdateResult markFailure(String id, String workerId, Instant failedAt, String error, Instant nextRunAtOrNull) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(failedAt, "failedAt must not be null");

        Update u = new Update()
                .inc("failCount", 1)
                .set("failedAt", failedAt)
                .set("lastError", truncate(error))
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");

        if (nextRunAtOrNull != null) {
            u.set("runAt", nextRunAtOrNull);
        } else {
            u.unset("runAt");
        }

        return mongoTemplate.updateFirst(lockedBy(id, workerId), u, QueuedJobDocument.class);
    }

    private static Query lockedBy(String id, String workerId) {
        return new Query(Criteria.where("_id").is(id).and("lockedBy").is(workerId));
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
