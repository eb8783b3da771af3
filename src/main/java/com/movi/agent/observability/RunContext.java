package com.movi.agent.observability;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-turn collector for observability data.
 * Created when a turn starts, filled in by the orchestrator, flushed to a TurnTrace at the end.
 *
 * Never checkpointed: it lives alongside SessionState, not inside it.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int promptTokens;
    private int completionTokens;

    public void recordToolCall(String capabilityName, Object args, long latencyMs, String result) {
        toolCallRecords.add(new ToolCallRecord(capabilityName, args, latencyMs, result));
    }

    public void addTokens(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public record ToolCallRecord(
            String capabilityName,
            Object args,
            long latencyMs,
            String result
    ) {}
}
