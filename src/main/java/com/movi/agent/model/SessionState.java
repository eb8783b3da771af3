package com.movi.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Full state of one conversation thread, persisted as a checkpoint between turns.
 *
 * The message log only grows: nodes call {@link #append(Message...)} and never
 * replace or edit earlier entries. The scalar fields describe the pending
 * interlock, if any.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {

    private String threadId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /** Caller-supplied page/context, e.g. busDashboard or manageRoute */
    private String contextTag;

    /** Trip targeted by the most recent dangerous call; cleared once resolved */
    private String targetEntityId;

    private RiskLevel consequenceRisk;

    private String consequenceMessage;

    private boolean awaitingConfirmation;

    public static SessionState empty(String threadId) {
        return SessionState.builder()
                .threadId(threadId)
                .awaitingConfirmation(false)
                .build();
    }

    /**
     * Working copy for a turn. Messages are immutable, so copying the list is enough
     * to keep the loaded checkpoint untouched if the turn aborts.
     */
    public SessionState copy() {
        return SessionState.builder()
                .threadId(threadId)
                .messages(new ArrayList<>(messages))
                .contextTag(contextTag)
                .targetEntityId(targetEntityId)
                .consequenceRisk(consequenceRisk)
                .consequenceMessage(consequenceMessage)
                .awaitingConfirmation(awaitingConfirmation)
                .build();
    }

    /** Concatenates in call order. */
    public void append(Message... newMessages) {
        Collections.addAll(messages, newMessages);
    }

    @JsonIgnore
    public Message lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    /** Message immediately before the last one, or null. */
    @JsonIgnore
    public Message previousMessage() {
        return messages.size() < 2 ? null : messages.get(messages.size() - 2);
    }

    public void clearInterlock() {
        this.targetEntityId = null;
        this.consequenceRisk = null;
        this.consequenceMessage = null;
        this.awaitingConfirmation = false;
    }
}
