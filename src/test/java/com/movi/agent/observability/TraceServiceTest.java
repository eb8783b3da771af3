package com.movi.agent.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.model.TurnReply;
import com.movi.agent.model.TurnStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TraceServiceTest {

    private TurnTraceRepository repository;
    private TraceService service;

    @BeforeEach
    void setUp() {
        repository = mock(TurnTraceRepository.class);
        service = new TraceService(repository, new ObjectMapper());
    }

    @Test
    void persistTrace_recordsOutcomeAndCapabilities() {
        RunContext runCtx = new RunContext();
        runCtx.addTokens(100, 25);
        runCtx.recordToolCall("list_todays_trips", Map.of(), 12, "[]");
        TurnReply reply = TurnReply.builder()
                .reply("WAIT!")
                .threadId("t1")
                .status(TurnStatus.AWAITING_CONFIRMATION)
                .awaitingConfirmation(true)
                .iterationsUsed(2)
                .build();

        service.persistTrace("t1", "remove vehicle", "busDashboard", reply, runCtx, null);

        ArgumentCaptor<TurnTrace> captor = ArgumentCaptor.forClass(TurnTrace.class);
        verify(repository).save(captor.capture());
        TurnTrace trace = captor.getValue();
        assertThat(trace.getStatus()).isEqualTo(TurnStatus.AWAITING_CONFIRMATION);
        assertThat(trace.isAwaitingConfirmation()).isTrue();
        assertThat(trace.getTotalTokens()).isEqualTo(125);
        assertThat(trace.getIterationsUsed()).isEqualTo(2);
        assertThat(trace.getToolCallsJson()).contains("\"capability\":\"list_todays_trips\"");
        assertThat(trace.getErrorMessage()).isNull();
    }

    @Test
    void persistTrace_withoutReply_recordsError() {
        service.persistTrace("t1", "hi", null, null, new RunContext(), new IllegalStateException("redis down"));

        ArgumentCaptor<TurnTrace> captor = ArgumentCaptor.forClass(TurnTrace.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getErrorMessage()).isEqualTo("redis down");
        assertThat(captor.getValue().getToolCallsJson()).isEqualTo("[]");
    }

    @Test
    void persistTrace_repositoryFailure_doesNotThrow() {
        when(repository.save(any())).thenThrow(new IllegalStateException("mongo down"));

        service.persistTrace("t1", "hi", null, null, new RunContext(), null);
    }

    @Test
    void analytics_summarisesRepositoryAggregates() {
        when(repository.avgLatency()).thenReturn(412.6);
        when(repository.totalTokensUsedSince(any())).thenReturn(9000L);
        when(repository.statusBreakdown()).thenReturn(List.of(
                new TurnTraceRepository.StatusCount("COMPLETED", 10),
                new TurnTraceRepository.StatusCount("AWAITING_CONFIRMATION", 3)));

        Map<String, Object> analytics = service.getAnalytics();

        assertThat(analytics)
                .containsEntry("avgLatencyMs", 413L)
                .containsEntry("totalTokensLast24h", 9000L)
                .containsEntry("interlockPauses", 3L);
    }
}
