package com.movi.agent.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the reasoning gateway for the provider selected by llm.provider.
 * The resilient decorator wraps this bean.
 */
@Configuration
@Slf4j
public class GatewayConfig {

    @Value("${llm.provider:openai}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Reasoning provider : {}", provider.toUpperCase());
        log.info("  Model              : {}", "groq".equalsIgnoreCase(provider) ? groqModel : openAiModel);
        log.info("================================================================");
    }

    @Bean("providerGateway")
    public ReasoningGateway providerGateway(
            ObjectMapper objectMapper,
            @Qualifier("gatewayRestClientBuilder") RestClient.Builder builder) {

        if ("groq".equalsIgnoreCase(provider)) {
            logKey("GROQ", groqKey, "GROQ_API_KEY");
            return new OpenAiCompatibleGateway(
                    props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp),
                    objectMapper, "groq", builder.clone());
        }
        logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
        return new OpenAiCompatibleGateway(
                props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp),
                objectMapper, "openai", builder.clone());
    }

    private GatewayProperties props(String key, String baseUrl, String model, int maxTokens, double temp) {
        GatewayProperties p = new GatewayProperties();
        p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temp);
        return p;
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
