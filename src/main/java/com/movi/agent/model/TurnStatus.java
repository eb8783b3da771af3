package com.movi.agent.model;

public enum TurnStatus {
    COMPLETED,
    AWAITING_CONFIRMATION,
    CANCELLED,
    GATEWAY_ERROR,
    LOOP_CEILING_EXCEEDED
}
