package com.movi.agent.audit;

import com.movi.agent.model.TurnStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-thread bookkeeping: how many turns completed, on which page, with which outcome.
 * The conversation itself lives in the checkpoint store, not here.
 */
@Document(collection = "movi_threads")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadMetadata {

    @Id
    private String threadId;

    @Builder.Default
    private int turnCount = 0;

    private String lastContextTag;

    private TurnStatus lastStatus;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    @Indexed
    private Instant updatedAt;
}
