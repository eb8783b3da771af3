package com.movi.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One entry of a thread's conversation log. Never modified once appended.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    Role role;

    String content;

    /**
     * Present when role = assistant and the reasoning service requested capabilities.
     * Echoed back verbatim on later requests so results can be correlated to calls.
     */
    List<CapabilityCall> toolCalls;

    /** Present when role = tool: links back to the assistant's call id */
    String toolCallId;

    /** Present when role = tool: the capability that produced this result */
    String name;

    /**
     * Present only on the system instruction written after the user confirmed a paused action.
     * Names the entity the confirmation applies to.
     */
    String confirmedEntityId;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message toolResult(CapabilityCall call, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(call.getId())
                .name(call.getName())
                .content(content)
                .build();
    }

    public static Message confirmationGrant(String entityId, String content) {
        return Message.builder()
                .role(Role.system)
                .content(content)
                .confirmedEntityId(entityId)
                .build();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    @JsonIgnore
    public boolean isConfirmationGrant() {
        return role == Role.system && confirmedEntityId != null;
    }
}
