package com.movi.agent.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.capability.CapabilityDefinition;
import com.movi.agent.exception.GatewayException;
import com.movi.agent.model.CapabilityCall;
import com.movi.agent.model.Decision;
import com.movi.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reasoning gateway for OpenAI-compatible chat completion APIs (OpenAI, Groq).
 *
 * Error handling:
 *
 * | Error                     | Action                                               |
 * |---------------------------|------------------------------------------------------|
 * | 400 tool_use_failed (Groq)| Recover the call from failed_generation, else fail   |
 * | other 4xx                 | GatewayException                                     |
 * | 5xx / 429                 | GatewayException (counts toward the circuit breaker) |
 * | network error / timeout   | GatewayException                                     |
 * | unparseable arguments     | GatewayException, arguments are never guessed        |
 *
 * Nothing is retried here: a retried turn could re-issue a dangerous call.
 */
@Slf4j
public class OpenAiCompatibleGateway implements ReasoningGateway {

    // Groq occasionally emits <function=name({"arg": "val"})</function> or
    // <function=name{"arg": "val"}></function> instead of a JSON tool call.
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public OpenAiCompatibleGateway(GatewayProperties props,
                                   ObjectMapper objectMapper,
                                   String providerName,
                                   RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public Decision decide(List<Message> history, List<CapabilityDefinition> capabilities) {
        Map<String, Object> requestBody = buildRequestBody(history, capabilities);

        log.debug("Sending {} messages to {} [model={}]", history.size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        if (body.contains("tool_use_failed")) {
                            throw new GroqToolUseFailedException(body);
                        }
                        throw new GatewayException(
                                providerName + " client error [" + res.getStatusCode().value() + "]: " + body);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new GatewayException(
                                providerName + " server error [" + res.getStatusCode().value() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            if (response == null) {
                throw new GatewayException(providerName + " returned an empty body");
            }
            return parseResponse(response);

        } catch (GroqToolUseFailedException e) {
            return recoverFromGroqToolUseFailure(e.getErrorBody());
        } catch (RestClientException e) {
            throw new GatewayException(providerName + " unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Groq's tool_use_failed error carries the broken generation in "failed_generation".
     * The call is recovered only when it parses completely.
     */
    @SuppressWarnings("unchecked")
    Decision recoverFromGroqToolUseFailure(String errorBody) {
        String failedGeneration;
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error = (Map<String, Object>) errorMap.get("error");
            failedGeneration = error == null ? null : (String) error.get("failed_generation");
        } catch (JsonProcessingException | ClassCastException e) {
            throw new GatewayException("Unparseable tool_use_failed body from " + providerName, e);
        }

        if (failedGeneration == null || failedGeneration.isBlank()) {
            throw new GatewayException(providerName + " tool_use_failed with no failed_generation");
        }

        Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
        if (!matcher.find()) {
            throw new GatewayException("Could not parse tool call from failed_generation: " + failedGeneration);
        }

        String name = matcher.group(1);
        Map<String, Object> args = parseArguments(name, matcher.group(2));
        log.info("Recovered Groq tool call: capability={} args={}", name, args);

        return Decision.invoke(CapabilityCall.builder()
                .id("groq-recovered-" + UUID.randomUUID().toString().substring(0, 8))
                .name(name)
                .arguments(args)
                .build());
    }

    Map<String, Object> buildRequestBody(List<Message> history, List<CapabilityDefinition> capabilities) {
        List<Map<String, Object>> formattedMessages = history.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!capabilities.isEmpty()) {
            body.put("tools", capabilities.stream().map(CapabilityDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.getRole() == Message.Role.assistant) {
            // An assistant message that made calls must carry tool_calls, or the provider
            // cannot correlate the tool results that follow it.
            m.put("content", msg.getContent());
            if (msg.hasToolCalls()) {
                m.put("tool_calls", msg.getToolCalls().stream()
                        .map(this::formatCall)
                        .toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatCall(CapabilityCall call) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", call.getName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(call.getArguments()));
        } catch (JsonProcessingException e) {
            throw new GatewayException("Could not serialize arguments of call " + call.getId(), e);
        }

        Map<String, Object> tc = new HashMap<>();
        tc.put("id", call.getId());
        tc.put("type", "function");
        tc.put("function", fn);
        return tc;
    }

    /**
     * Any response shape other than the documented one is a GatewayException.
     */
    Decision parseResponse(Map<String, Object> response) {
        try {
            return parseWellFormed(response);
        } catch (ClassCastException e) {
            throw new GatewayException("Unexpected response shape from " + providerName + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Decision parseWellFormed(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new GatewayException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = tokenCount(usage.get("prompt_tokens"));
            completionTokens = tokenCount(usage.get("completion_tokens"));
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        if (message == null) {
            throw new GatewayException(providerName + " returned a choice without a message");
        }

        List<Map<String, Object>> toolCalls = (List<Map<String, Object>>) message.get("tool_calls");
        List<CapabilityCall> calls = new ArrayList<>();
        if (toolCalls != null) {
            for (Map<String, Object> toolCall : toolCalls) {
                calls.add(parseCall(toolCall));
            }
        }

        return Decision.builder()
                .content((String) message.get("content"))
                .calls(calls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    private static int tokenCount(Object value) {
        return value == null ? 0 : ((Number) value).intValue();
    }

    @SuppressWarnings("unchecked")
    private CapabilityCall parseCall(Map<String, Object> toolCall) {
        String id = (String) toolCall.get("id");
        Map<String, Object> function = (Map<String, Object>) toolCall.get("function");
        if (id == null || function == null || function.get("name") == null) {
            throw new GatewayException("Malformed tool call from " + providerName + ": " + toolCall);
        }
        String name = (String) function.get("name");
        Object rawArgs = function.get("arguments");
        String argsJson = rawArgs == null ? "{}" : rawArgs.toString();

        return CapabilityCall.builder()
                .id(id)
                .name(name)
                .arguments(parseArguments(name, argsJson.isBlank() ? "{}" : argsJson))
                .build();
    }

    private Map<String, Object> parseArguments(String name, String json) {
        try {
            Map<String, Object> args = objectMapper.readValue(json, new TypeReference<>() {});
            return args != null ? args : Map.of();
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to parse arguments for " + name + ": " + json, e);
        }
    }

    private static class GroqToolUseFailedException extends RuntimeException {
        private final String errorBody;

        GroqToolUseFailedException(String errorBody) {
            super("Groq tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
