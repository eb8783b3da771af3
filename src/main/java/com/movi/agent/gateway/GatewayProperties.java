package com.movi.agent.gateway;

import lombok.Data;

/**
 * Config for a single OpenAI-compatible provider.
 * Populated from application.yml for openai / groq.
 */
@Data
public class GatewayProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;
}
