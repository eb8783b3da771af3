package com.movi.agent.api;

import com.movi.agent.audit.ThreadAuditService;
import com.movi.agent.audit.ThreadMetadata;
import com.movi.agent.checkpoint.InMemoryCheckpointStore;
import com.movi.agent.model.Message;
import com.movi.agent.model.RiskLevel;
import com.movi.agent.model.SessionState;
import com.movi.agent.model.TurnStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ThreadControllerTest {

    private InMemoryCheckpointStore store;
    private ThreadAuditService auditService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore();
        auditService = mock(ThreadAuditService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ThreadController(store, auditService)).build();
    }

    @Test
    void getThread_returnsCheckpoint() throws Exception {
        SessionState state = SessionState.empty("thread-a");
        state.append(Message.user("Remove the vehicle from trip_1"));
        state.setTargetEntityId("trip_1");
        state.setConsequenceRisk(RiskLevel.HIGH);
        state.setAwaitingConfirmation(true);
        store.save(state);

        mockMvc.perform(get("/api/threads/thread-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.threadId").value("thread-a"))
                .andExpect(jsonPath("$.awaitingConfirmation").value(true))
                .andExpect(jsonPath("$.consequenceRisk").value("HIGH"))
                .andExpect(jsonPath("$.messages[0].role").value("user"));
    }

    @Test
    void getThread_unknown_isNotFound() throws Exception {
        mockMvc.perform(get("/api/threads/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getMetadata_returnsTurnCount() throws Exception {
        when(auditService.find("thread-a")).thenReturn(Optional.of(ThreadMetadata.builder()
                .threadId("thread-a")
                .turnCount(3)
                .lastStatus(TurnStatus.CANCELLED)
                .build()));

        mockMvc.perform(get("/api/threads/thread-a/metadata"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.turnCount").value(3))
                .andExpect(jsonPath("$.lastStatus").value("CANCELLED"));
    }
}
