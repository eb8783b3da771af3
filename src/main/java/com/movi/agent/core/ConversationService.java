package com.movi.agent.core;

import com.movi.agent.audit.ThreadAuditService;
import com.movi.agent.checkpoint.CheckpointStore;
import com.movi.agent.exception.GatewayException;
import com.movi.agent.exception.LoopCeilingExceededException;
import com.movi.agent.model.SessionState;
import com.movi.agent.model.TurnReply;
import com.movi.agent.model.TurnStatus;
import com.movi.agent.observability.RunContext;
import com.movi.agent.observability.TraceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-facing turn API.
 *
 * Per-turn flow:
 * 1. Acquire the thread's lock
 * 2. Load the checkpoint (or start an empty thread) and take a working copy
 * 3. Run the state machine on the copy
 * 4. Save the copy; only a completed turn is ever checkpointed
 * 5. Record thread metadata; trace asynchronously, even on failure
 *
 * Gateway failures and loop-ceiling failures become explicit failure replies; the previous
 * checkpoint stays as it was. Checkpoint failures propagate so the caller retries the turn.
 */
@Service
@Slf4j
public class ConversationService {

    static final String GATEWAY_FAILURE_REPLY =
            "I'm sorry, I couldn't reach the planning service. Nothing was changed, please try again.";
    static final String LOOP_FAILURE_REPLY =
            "I'm sorry, I couldn't finish this request: it needed more steps than I'm allowed. "
                    + "Please try a simpler request.";

    private final TurnOrchestrator orchestrator;
    private final CheckpointStore checkpointStore;
    private final ThreadLockRegistry lockRegistry;
    private final ThreadAuditService auditService;
    private final TraceService traceService;

    public ConversationService(TurnOrchestrator orchestrator,
                               CheckpointStore checkpointStore,
                               ThreadLockRegistry lockRegistry,
                               ThreadAuditService auditService,
                               TraceService traceService) {
        this.orchestrator = orchestrator;
        this.checkpointStore = checkpointStore;
        this.lockRegistry = lockRegistry;
        this.auditService = auditService;
        this.traceService = traceService;
    }

    public TurnReply submitTurn(String threadId, String userText, String contextTag) {
        String resolvedThreadId = resolveThreadId(threadId);

        log.info("Turn started [thread={}, page={}, input='{}']", resolvedThreadId, contextTag, userText);

        RunContext runCtx = new RunContext();
        TurnReply reply = null;
        Throwable error = null;
        AtomicBoolean pendingBefore = new AtomicBoolean(false);

        try {
            reply = lockRegistry.withLock(resolvedThreadId,
                    () -> executeTurn(resolvedThreadId, userText, contextTag, runCtx, pendingBefore));
        } catch (GatewayException e) {
            log.error("Turn aborted by gateway failure [thread={}]: {}", resolvedThreadId, e.getMessage(), e);
            error = e;
            reply = failure(resolvedThreadId, TurnStatus.GATEWAY_ERROR, GATEWAY_FAILURE_REPLY, pendingBefore.get());
        } catch (LoopCeilingExceededException e) {
            log.error("Turn aborted: {}", e.getMessage());
            error = e;
            reply = failure(resolvedThreadId, TurnStatus.LOOP_CEILING_EXCEEDED, LOOP_FAILURE_REPLY,
                    pendingBefore.get());
        } catch (RuntimeException e) {
            log.error("Turn failed [thread={}]", resolvedThreadId, e);
            error = e;
            throw e;
        } finally {
            traceService.persistTrace(resolvedThreadId, userText, contextTag, reply, runCtx, error);
        }

        log.info("Turn complete [thread={}, status={}, awaitingConfirmation={}, latency={}ms, tokens={}]",
                resolvedThreadId, reply.getStatus(), reply.isAwaitingConfirmation(),
                runCtx.elapsedMs(), runCtx.totalTokens());
        return reply;
    }

    private TurnReply executeTurn(String threadId, String userText, String contextTag, RunContext runCtx,
                                  AtomicBoolean pendingBefore) {
        SessionState working = checkpointStore.load(threadId)
                .orElseGet(() -> SessionState.empty(threadId))
                .copy();
        pendingBefore.set(working.isAwaitingConfirmation());
        if (contextTag != null && !contextTag.isBlank()) {
            working.setContextTag(contextTag);
        }

        TurnReply reply = orchestrator.runTurn(working, userText, runCtx);

        checkpointStore.save(working);
        auditService.recordTurn(threadId, working.getContextTag(), reply.getStatus());
        return reply;
    }

    /**
     * A failed turn saves nothing, so the pending flag is the one read under the lock at turn start.
     */
    private TurnReply failure(String threadId, TurnStatus status, String message, boolean stillAwaiting) {
        return TurnReply.builder()
                .reply(message)
                .awaitingConfirmation(stillAwaiting)
                .threadId(threadId)
                .status(status)
                .capabilitiesExecuted(List.of())
                .build();
    }

    private String resolveThreadId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }
}
