package com.movi.agent.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.core.ConversationService;
import com.movi.agent.exception.DuplicateRequestException;
import com.movi.agent.model.ChatRequest;
import com.movi.agent.model.TurnReply;
import com.movi.agent.model.TurnStatus;
import com.movi.agent.resilience.IdempotencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Chat endpoint with idempotency support.
 *
 * POST /api/chat
 *   Optional header: Idempotency-Key: <uuid>
 *   Duplicate requests within 24h return the cached reply instead of running the turn again.
 *
 * GET /api/health
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConversationService conversationService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/chat")
    public ResponseEntity<TurnReply> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Chat request [thread={}, page={}, idempotencyKey={}]",
                request.getThreadId(), request.getCurrentPage(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<TurnReply> cached = readCached(idempotencyKey);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                throw new DuplicateRequestException(idempotencyKey);
            }
        }

        TurnReply reply;
        try {
            reply = conversationService.submitTurn(
                    request.getThreadId(), request.getMessage(), request.getCurrentPage());
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            if (isFailure(reply)) {
                idempotencyService.releaseKey(idempotencyKey);
            } else {
                cache(idempotencyKey, reply);
            }
        }

        if (reply.getStatus() == TurnStatus.LOOP_CEILING_EXCEEDED) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(reply);
        }
        return ResponseEntity.ok(reply);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private Optional<TurnReply> readCached(String idempotencyKey) {
        Optional<String> cached = idempotencyService.getCachedResponse(idempotencyKey);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            log.info("Returning cached reply for idempotency key={}", idempotencyKey);
            return Optional.of(objectMapper.readValue(cached.get(), TurnReply.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cached reply for key={}, running fresh", idempotencyKey, e);
            return Optional.empty();
        }
    }

    private void cache(String idempotencyKey, TurnReply reply) {
        try {
            idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(reply));
        } catch (JsonProcessingException e) {
            log.warn("Failed to cache reply for idempotency key={}", idempotencyKey, e);
        }
    }

    private boolean isFailure(TurnReply reply) {
        return reply.getStatus() == TurnStatus.GATEWAY_ERROR
                || reply.getStatus() == TurnStatus.LOOP_CEILING_EXCEEDED;
    }
}
