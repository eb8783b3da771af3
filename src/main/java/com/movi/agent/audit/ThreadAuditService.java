package com.movi.agent.audit;

import com.movi.agent.model.TurnStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Thread metadata backed by MongoDB.
 *
 * The upsert touches turnCount only through $inc: on insert Mongo starts the field at 0,
 * so the first turn yields 1. createdAt is set with $setOnInsert since findAndModify
 * bypasses auditing callbacks.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThreadAuditService {

    private final ThreadMetadataRepository threadRepo;
    private final MongoTemplate mongoTemplate;

    /**
     * Records a completed turn. Failures are logged only: the checkpoint is already saved.
     */
    public void recordTurn(String threadId, String contextTag, TurnStatus status) {
        Query query = new Query(Criteria.where("_id").is(threadId));
        Instant now = Instant.now();

        Update update = new Update()
                .setOnInsert("createdAt", now)
                .set("updatedAt", now)
                .set("lastContextTag", contextTag)
                .set("lastStatus", status)
                .inc("turnCount", 1);

        FindAndModifyOptions options = FindAndModifyOptions.options()
                .upsert(true)
                .returnNew(true);

        try {
            ThreadMetadata result = mongoTemplate.findAndModify(query, update, options, ThreadMetadata.class);
            if (result != null) {
                log.debug("Thread upserted [thread={}, turnCount={}, status={}]",
                        threadId, result.getTurnCount(), status);
            }
        } catch (DataAccessException e) {
            log.warn("Could not record thread metadata [thread={}]: {}", threadId, e.getMessage());
        }
    }

    public Optional<ThreadMetadata> find(String threadId) {
        return threadRepo.findById(threadId);
    }

    public List<ThreadMetadata> recentThreads() {
        return threadRepo.findTop20ByOrderByUpdatedAtDesc();
    }
}
