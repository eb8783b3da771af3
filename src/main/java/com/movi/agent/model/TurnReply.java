package com.movi.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnReply {

    @JsonProperty("response")
    private String reply;

    @JsonProperty("awaiting_confirmation")
    private boolean awaitingConfirmation;

    @JsonProperty("thread_id")
    private String threadId;

    private TurnStatus status;

    /** Names of the capabilities dispatched during the turn, in order */
    @Builder.Default
    @JsonProperty("capabilities_executed")
    private List<String> capabilitiesExecuted = new ArrayList<>();

    @JsonProperty("iterations_used")
    private int iterationsUsed;
}
