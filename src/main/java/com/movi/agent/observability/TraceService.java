package com.movi.agent.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.model.TurnReply;
import com.movi.agent.model.TurnStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists turn traces and exposes analytics.
 *
 * Persistence is @Async and never throws: a lost trace must not fail a turn.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final TurnTraceRepository traceRepository;
    private final ObjectMapper objectMapper;

    @Async("traceTaskExecutor")
    public void persistTrace(String threadId, String userInput, String contextTag,
                             TurnReply reply, RunContext runCtx, Throwable error) {
        try {
            TurnTrace trace = TurnTrace.builder()
                    .threadId(threadId)
                    .contextTag(contextTag)
                    .userInput(truncate(userInput, 4000))
                    .reply(reply != null ? truncate(reply.getReply(), 8000) : null)
                    .status(reply != null ? reply.getStatus() : null)
                    .awaitingConfirmation(reply != null && reply.isAwaitingConfirmation())
                    .iterationsUsed(reply != null ? reply.getIterationsUsed() : 0)
                    .totalLatencyMs(runCtx.elapsedMs())
                    .promptTokens(runCtx.getPromptTokens())
                    .completionTokens(runCtx.getCompletionTokens())
                    .totalTokens(runCtx.totalTokens())
                    .toolCallsJson(serializeToolCalls(runCtx.getToolCallRecords()))
                    .errorMessage(error != null ? truncate(error.getMessage(), 2000) : null)
                    .build();

            traceRepository.save(trace);

            log.debug("Trace persisted [thread={}, status={}, latency={}ms]",
                    threadId, trace.getStatus(), trace.getTotalLatencyMs());

        } catch (Exception e) {
            log.error("Failed to persist turn trace for thread={}", threadId, e);
        }
    }

    public List<TurnTrace> getTracesForThread(String threadId) {
        return traceRepository.findByThreadIdOrderByCreatedAtDesc(threadId);
    }

    /**
     * Avg latency, token usage over the last 24h, and a per-status breakdown.
     */
    public Map<String, Object> getAnalytics() {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatency();
        Long tokensLast24h = traceRepository.totalTokensUsedSince(since24h);

        Map<String, Long> statusBreakdown = traceRepository.statusBreakdown().stream()
                .filter(row -> row.id() != null)
                .collect(Collectors.toMap(
                        TurnTraceRepository.StatusCount::id,
                        TurnTraceRepository.StatusCount::count));

        return Map.of(
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0L,
                "totalTokensLast24h", tokensLast24h != null ? tokensLast24h : 0L,
                "statusBreakdown", statusBreakdown,
                "interlockPauses", statusBreakdown.getOrDefault(TurnStatus.AWAITING_CONFIRMATION.name(), 0L)
        );
    }

    String serializeToolCalls(List<RunContext.ToolCallRecord> records) {
        if (records.isEmpty()) return "[]";
        try {
            return objectMapper.writeValueAsString(records.stream()
                    .map(r -> Map.of(
                            "capability", r.capabilityName(),
                            "latencyMs", r.latencyMs(),
                            "resultPreview", r.result() != null ? truncate(r.result(), 200) : ""
                    ))
                    .toList());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize tool call records: {}", e.getMessage());
            return "[]";
        }
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
