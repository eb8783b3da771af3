package com.movi.agent.model;

public enum RiskLevel {
    LOW, HIGH
}
