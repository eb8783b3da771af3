package com.movi.agent.core;

import com.movi.agent.capability.CapabilityRegistry;
import com.movi.agent.capability.ToolDispatcher;
import com.movi.agent.config.OrchestratorProperties;
import com.movi.agent.consequence.ConsequenceAssessment;
import com.movi.agent.consequence.ConsequenceEvaluator;
import com.movi.agent.exception.GatewayException;
import com.movi.agent.exception.LoopCeilingExceededException;
import com.movi.agent.gateway.ReasoningGateway;
import com.movi.agent.model.CapabilityCall;
import com.movi.agent.model.Decision;
import com.movi.agent.model.Message;
import com.movi.agent.model.RiskLevel;
import com.movi.agent.model.SessionState;
import com.movi.agent.model.TurnReply;
import com.movi.agent.model.TurnStatus;
import com.movi.agent.observability.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turn state machine: reasoning → (consequence check → confirmation) → tool dispatch → reasoning ...
 *
 * Per-turn flow:
 * 1. START: seed the system prompt on a new thread, append the user message; if a
 *    confirmation is pending, resolve it (grant or cancel) instead of reasoning afresh
 * 2. REASONING: ask the gateway, append its decision, route on the requested calls
 * 3. EVALUATING_CONSEQUENCE: any batch containing the dangerous capability is gated
 *    as a whole; HIGH risk pauses every call in it
 * 4. CONFIRMING: ask the user, suspend with awaitingConfirmation = true
 * 5. DISPATCHING_TOOLS: run the batch in order, then loop back to REASONING, at most
 *    maxToolIterations times
 *
 * The orchestrator only mutates the SessionState it is handed; loading, saving and
 * per-thread serialization belong to {@link ConversationService}.
 */
@Service
@Slf4j
public class TurnOrchestrator {

    static final String SYSTEM_PROMPT = """
            You are 'Movi', an expert transport manager AI.

            CRITICAL RULES:
            1. ID LOOKUP: If the user gives you a Trip Name (e.g., "Bulk - 00:01"), you MUST first call \
            `list_todays_trips` to find its `trip_id`.
               - NEVER guess the ID.
               - NEVER use the Name as the ID.

            2. SAFETY CHECK:
               - Once you have the `trip_id`, call `remove_vehicle_from_trip_action`.
               - Do NOT check bookings yourself. The system will intercept and check safety.

            3. VEHICLE LISTING:
               - When the user asks for "all available buses", "all vehicles", or similar, you MUST call \
            `list_unassigned_vehicles`.
               - Then summarise the vehicles clearly: ID, license plate, type, capacity.

            4. If a tool returns an ERROR, explain the problem to the user instead of repeating the same call.
            """;

    static final String NOT_EXECUTED_NOTICE =
            "NOT EXECUTED: this batch contains an action paused pending user confirmation.";

    private final ReasoningGateway gateway;
    private final CapabilityRegistry registry;
    private final ToolDispatcher dispatcher;
    private final ConsequenceEvaluator consequenceEvaluator;
    private final ConfirmationGate confirmationGate;
    private final OrchestratorProperties properties;

    public TurnOrchestrator(ReasoningGateway gateway,
                            CapabilityRegistry registry,
                            ToolDispatcher dispatcher,
                            ConsequenceEvaluator consequenceEvaluator,
                            ConfirmationGate confirmationGate,
                            OrchestratorProperties properties) {
        this.gateway = gateway;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.consequenceEvaluator = consequenceEvaluator;
        this.confirmationGate = confirmationGate;
        this.properties = properties;
    }

    /**
     * Runs one turn against {@code state}, mutating it in place.
     *
     * @throws GatewayException              reasoning step failed or returned malformed calls
     * @throws LoopCeilingExceededException  too many dispatch rounds in one turn
     */
    public TurnReply runTurn(SessionState state, String userText, RunContext runCtx) {
        TurnContext ctx = new TurnContext(state, runCtx);
        TurnNode node = TurnNode.START;

        while (node != TurnNode.END) {
            TurnNode next = switch (node) {
                case START -> start(ctx, userText);
                case REASONING -> reason(ctx);
                case EVALUATING_CONSEQUENCE -> evaluateConsequence(ctx);
                case CONFIRMING -> confirm(ctx);
                case DISPATCHING_TOOLS -> dispatchTools(ctx);
                case END -> throw new IllegalStateException("END is terminal");
            };
            log.debug("Transition {} → {} [thread={}]", node, next, ctx.getThreadId());
            node = next;
        }

        return TurnReply.builder()
                .reply(lastAssistantContent(state))
                .awaitingConfirmation(state.isAwaitingConfirmation())
                .threadId(state.getThreadId())
                .status(ctx.getStatus())
                .capabilitiesExecuted(ctx.getExecutedCapabilities())
                .iterationsUsed(ctx.getReasoningSteps())
                .build();
    }

    // ─── Nodes ────────────────────────────────────────────────────────────────

    private TurnNode start(TurnContext ctx, String userText) {
        SessionState state = ctx.getState();

        if (state.getMessages().isEmpty()) {
            state.append(Message.system(SYSTEM_PROMPT));
        }
        state.append(Message.user(userText));

        if (!state.isAwaitingConfirmation()) {
            return TurnNode.REASONING;
        }

        String target = state.getTargetEntityId();
        if (target == null) {
            log.warn("Checkpoint awaited confirmation without a target entity, ignoring [thread={}]",
                    ctx.getThreadId());
            state.clearInterlock();
            return TurnNode.REASONING;
        }
        if (!confirmationGate.isAffirmative(userText)) {
            log.info("Pending action on entity={} cancelled by user [thread={}]", target, ctx.getThreadId());
            state.append(confirmationGate.cancellation());
            state.clearInterlock();
            ctx.setStatus(TurnStatus.CANCELLED);
            return TurnNode.END;
        }

        log.info("User confirmed pending action on entity={} [thread={}]", target, ctx.getThreadId());
        state.append(confirmationGate.grant(target));
        state.setAwaitingConfirmation(false);
        state.setConsequenceRisk(null);
        return route(ctx, decide(ctx));
    }

    private TurnNode reason(TurnContext ctx) {
        return route(ctx, decide(ctx));
    }

    private TurnNode evaluateConsequence(TurnContext ctx) {
        SessionState state = ctx.getState();
        List<CapabilityCall> batch = state.lastMessage().getToolCalls();

        CapabilityCall paused = null;
        ConsequenceAssessment pausedAssessment = null;
        List<String> lowRisk = new ArrayList<>();

        for (CapabilityCall call : dangerousCalls(batch)) {
            String entityId = targetOf(call);
            ConsequenceAssessment assessment = consequenceEvaluator.evaluate(entityId);
            if (assessment.isHigh() && paused == null) {
                paused = call;
                pausedAssessment = assessment;
            } else if (!assessment.isHigh()) {
                lowRisk.add(entityId);
            }
        }

        if (paused == null) {
            CapabilityCall first = dangerousCalls(batch).get(0);
            state.setTargetEntityId(targetOf(first));
            state.setConsequenceRisk(RiskLevel.LOW);
            state.setConsequenceMessage(null);
            ctx.getClearedEntities().addAll(lowRisk);
            return TurnNode.DISPATCHING_TOOLS;
        }

        log.warn("Interlock engaged for entity={} (metric={}) [thread={}]",
                targetOf(paused), pausedAssessment.metric(), ctx.getThreadId());

        state.setTargetEntityId(targetOf(paused));
        state.setConsequenceRisk(RiskLevel.HIGH);
        state.setConsequenceMessage(pausedAssessment.warning());

        // Every call in the batch gets a result so the log stays well-formed for the gateway.
        for (CapabilityCall call : batch) {
            String notice = call == paused
                    ? ConsequenceEvaluator.interlockNotice(pausedAssessment.metric())
                    : NOT_EXECUTED_NOTICE;
            state.append(Message.toolResult(call, notice));
        }
        return TurnNode.CONFIRMING;
    }

    private TurnNode confirm(TurnContext ctx) {
        SessionState state = ctx.getState();
        state.append(confirmationGate.prompt(state.getConsequenceMessage()));
        state.setAwaitingConfirmation(true);
        ctx.setStatus(TurnStatus.AWAITING_CONFIRMATION);
        return TurnNode.END;
    }

    private TurnNode dispatchTools(TurnContext ctx) {
        int ceiling = properties.getMaxToolIterations();
        if (ctx.getDispatchRounds() >= ceiling) {
            log.warn("Tool loop hit ceiling ({}) [thread={}]", ceiling, ctx.getThreadId());
            throw new LoopCeilingExceededException(ctx.getThreadId(), ceiling);
        }
        ctx.setDispatchRounds(ctx.getDispatchRounds() + 1);

        SessionState state = ctx.getState();
        List<CapabilityCall> batch = state.lastMessage().getToolCalls();

        boolean dangerousDispatched = false;
        for (CapabilityCall call : dangerousCalls(batch)) {
            String entityId = targetOf(call);
            if (!ctx.getClearedEntities().remove(entityId)) {
                throw new IllegalStateException(
                        "Dangerous call " + call.getId() + " reached dispatch without clearance");
            }
            dangerousDispatched = true;
        }

        for (CapabilityCall call : batch) {
            long startMs = System.currentTimeMillis();
            String observation = dispatcher.execute(call);
            ctx.getRunContext().recordToolCall(call.getName(), call.getArguments(),
                    System.currentTimeMillis() - startMs, observation);
            ctx.getExecutedCapabilities().add(call.getName());
            state.append(Message.toolResult(call, observation));
        }

        if (dangerousDispatched) {
            state.setTargetEntityId(null);
            state.setConsequenceMessage(null);
        }
        return TurnNode.REASONING;
    }

    // ─── Routing ──────────────────────────────────────────────────────────────

    private Decision decide(TurnContext ctx) {
        SessionState state = ctx.getState();
        ctx.setReasoningSteps(ctx.getReasoningSteps() + 1);
        log.info("Reasoning step {} [thread={}]", ctx.getReasoningSteps(), ctx.getThreadId());

        Decision decision = gateway.decide(List.copyOf(state.getMessages()), registry.getAllDefinitions());
        if (decision == null) {
            throw new GatewayException("Reasoning gateway returned no decision");
        }
        ctx.getRunContext().addTokens(decision.getPromptTokens(), decision.getCompletionTokens());
        state.append(decision.toMessage());
        return decision;
    }

    private TurnNode route(TurnContext ctx, Decision decision) {
        if (!decision.hasCalls()) {
            return TurnNode.END;
        }

        List<CapabilityCall> dangerous = dangerousCalls(decision.getCalls());
        if (dangerous.isEmpty()) {
            return TurnNode.DISPATCHING_TOOLS;
        }

        // Arguments are validated before anything is evaluated or dispatched.
        dangerous.forEach(this::targetOf);

        Message preceding = ctx.getState().previousMessage();
        if (preceding != null && preceding.isConfirmationGrant() && dangerous.size() == 1
                && preceding.getConfirmedEntityId().equals(targetOf(dangerous.get(0)))) {
            log.info("Dispatching confirmed action on entity={} without re-evaluation [thread={}]",
                    preceding.getConfirmedEntityId(), ctx.getThreadId());
            ctx.getClearedEntities().add(preceding.getConfirmedEntityId());
            return TurnNode.DISPATCHING_TOOLS;
        }
        return TurnNode.EVALUATING_CONSEQUENCE;
    }

    private List<CapabilityCall> dangerousCalls(List<CapabilityCall> calls) {
        String dangerousName = properties.getDangerousCapability();
        return calls.stream()
                .filter(call -> dangerousName.equals(call.getName()))
                .toList();
    }

    /** Target entity of a dangerous call; missing arguments are never guessed. */
    private String targetOf(CapabilityCall call) {
        String entityId = call.stringArgument(properties.getTargetArgument());
        if (entityId == null) {
            throw new GatewayException("Call " + call.getId() + " to " + call.getName()
                    + " is missing required argument '" + properties.getTargetArgument() + "'");
        }
        return entityId;
    }

    /** Content of this turn's final assistant message; an empty reply stays empty. */
    private static String lastAssistantContent(SessionState state) {
        List<Message> messages = state.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.getRole() == Message.Role.assistant) {
                return message.getContent() != null ? message.getContent() : "";
            }
        }
        return "";
    }
}
