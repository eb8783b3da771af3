package com.movi.agent.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.core.ConversationService;
import com.movi.agent.exception.CheckpointException;
import com.movi.agent.exception.GlobalExceptionHandler;
import com.movi.agent.exception.ThreadBusyException;
import com.movi.agent.model.TurnReply;
import com.movi.agent.model.TurnStatus;
import com.movi.agent.resilience.IdempotencyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ChatControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConversationService conversationService;
    private IdempotencyService idempotencyService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        idempotencyService = mock(IdempotencyService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ChatController(conversationService, idempotencyService, objectMapper))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void chat_pausedTurn_returnsWarningAndAwaitingFlag() throws Exception {
        when(conversationService.submitTurn("thread-a", "Remove the vehicle from Bulk - 00:01", "busDashboard"))
                .thenReturn(reply("thread-a", TurnStatus.AWAITING_CONFIRMATION, true,
                        "WAIT! This trip is 60% booked."));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message": "Remove the vehicle from Bulk - 00:01", "thread_id": "thread-a"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("WAIT! This trip is 60% booked."))
                .andExpect(jsonPath("$.awaiting_confirmation").value(true))
                .andExpect(jsonPath("$.thread_id").value("thread-a"))
                .andExpect(jsonPath("$.status").value("AWAITING_CONFIRMATION"));
    }

    @Test
    void chat_blankMessage_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void chat_gatewayError_isDegradedReply() throws Exception {
        when(conversationService.submitTurn(any(), anyString(), any()))
                .thenReturn(reply("t1", TurnStatus.GATEWAY_ERROR, false, "I'm sorry, I couldn't reach the planning service."));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"hi\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("GATEWAY_ERROR"));
    }

    @Test
    void chat_loopCeiling_isServerError() throws Exception {
        when(conversationService.submitTurn(any(), anyString(), any()))
                .thenReturn(reply("t1", TurnStatus.LOOP_CEILING_EXCEEDED, false, "I'm sorry, I couldn't finish."));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"hi\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("LOOP_CEILING_EXCEEDED"));
    }

    @Test
    void chat_checkpointFailure_isServiceUnavailable() throws Exception {
        when(conversationService.submitTurn(any(), anyString(), any()))
                .thenThrow(new CheckpointException("redis down", new RuntimeException()));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"hi\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void chat_threadBusy_isConflict() throws Exception {
        when(conversationService.submitTurn(any(), anyString(), any()))
                .thenThrow(new ThreadBusyException("t1"));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"yes\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void chat_repeatedIdempotencyKey_replaysCachedReply() throws Exception {
        TurnReply cached = reply("t1", TurnStatus.COMPLETED, false, "Vehicle removed.");
        when(idempotencyService.getCachedResponse("key-1"))
                .thenReturn(Optional.of(objectMapper.writeValueAsString(cached)));

        mockMvc.perform(post("/api/chat")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"yes\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Vehicle removed."));

        verify(conversationService, never()).submitTurn(any(), anyString(), any());
    }

    @Test
    void chat_newIdempotencyKey_runsTurnAndCachesReply() throws Exception {
        when(idempotencyService.getCachedResponse("key-2")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("key-2")).thenReturn(true);
        when(conversationService.submitTurn(any(), anyString(), any()))
                .thenReturn(reply("t1", TurnStatus.COMPLETED, false, "Done."));

        mockMvc.perform(post("/api/chat")
                        .header("Idempotency-Key", "key-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"hi\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isOk());

        verify(idempotencyService).storeResponse(eq("key-2"), anyString());
    }

    @Test
    void chat_idempotencyKeyInFlight_isConflict() throws Exception {
        when(idempotencyService.getCachedResponse("key-3")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("key-3")).thenReturn(false);

        mockMvc.perform(post("/api/chat")
                        .header("Idempotency-Key", "key-3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"yes\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isConflict());

        verify(conversationService, never()).submitTurn(any(), anyString(), any());
    }

    @Test
    void chat_failedTurnWithIdempotencyKey_releasesKey() throws Exception {
        when(idempotencyService.getCachedResponse("key-4")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("key-4")).thenReturn(true);
        when(conversationService.submitTurn(any(), anyString(), any()))
                .thenReturn(reply("t1", TurnStatus.GATEWAY_ERROR, false, "sorry"));

        mockMvc.perform(post("/api/chat")
                        .header("Idempotency-Key", "key-4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"hi\", \"thread_id\": \"t1\"}"))
                .andExpect(status().isOk());

        verify(idempotencyService).releaseKey("key-4");
        verify(idempotencyService, never()).storeResponse(anyString(), anyString());
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    private static TurnReply reply(String threadId, TurnStatus status, boolean awaiting, String text) {
        return TurnReply.builder()
                .threadId(threadId)
                .status(status)
                .awaitingConfirmation(awaiting)
                .reply(text)
                .capabilitiesExecuted(List.of())
                .build();
    }
}
