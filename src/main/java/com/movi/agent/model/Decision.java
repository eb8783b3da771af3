package com.movi.agent.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Output of one reasoning step: either a plain reply or a batch of capability calls.
 */
@Data
@Builder
public class Decision {

    /** May be null when the reasoning service only requested calls */
    private String content;

    @Builder.Default
    private List<CapabilityCall> calls = List.of();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public static Decision reply(String content) {
        return Decision.builder().content(content).build();
    }

    public static Decision invoke(CapabilityCall... calls) {
        return Decision.builder().calls(List.of(calls)).build();
    }

    public boolean hasCalls() {
        return calls != null && !calls.isEmpty();
    }

    public Message toMessage() {
        return Message.builder()
                .role(Message.Role.assistant)
                .content(content)
                .toolCalls(hasCalls() ? List.copyOf(calls) : null)
                .build();
    }
}
