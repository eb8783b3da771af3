package com.movi.agent.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TurnTraceRepository extends MongoRepository<TurnTrace, String> {

    List<TurnTrace> findByThreadIdOrderByCreatedAtDesc(String threadId);

    @Aggregation(pipeline = {
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatency();

    @Aggregation(pipeline = {
        "{ $match: { 'createdAt': { $gte: ?0 } } }",
        "{ $group: { _id: null, total: { $sum: '$totalTokens' } } }"
    })
    Long totalTokensUsedSince(Instant since);

    @Aggregation(pipeline = {
        "{ $group: { _id: '$status', count: { $sum: 1 } } }"
    })
    List<StatusCount> statusBreakdown();

    record StatusCount(String id, long count) {}
}
