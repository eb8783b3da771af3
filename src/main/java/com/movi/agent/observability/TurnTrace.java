package com.movi.agent.observability;

import com.movi.agent.model.TurnStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One document per turn: input, reply, outcome, latency, token usage and the
 * capabilities dispatched in order.
 *
 * toolCallsJson example: [{"capability":"get_trip_details","latencyMs":12,"resultPreview":"..."}]
 */
@Document(collection = "movi_turn_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnTrace {

    @Id
    private String id;

    @Indexed
    private String threadId;

    private String contextTag;

    private String userInput;

    private String reply;

    @Indexed
    private TurnStatus status;

    private boolean awaitingConfirmation;
    private int iterationsUsed;
    private long totalLatencyMs;

    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    private String toolCallsJson;

    /** Set when the turn failed with an exception. */
    private String errorMessage;

    @CreatedDate
    @Indexed
    private Instant createdAt;
}
