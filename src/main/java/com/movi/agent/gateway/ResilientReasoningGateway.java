package com.movi.agent.gateway;

import com.movi.agent.capability.CapabilityDefinition;
import com.movi.agent.exception.GatewayException;
import com.movi.agent.model.Decision;
import com.movi.agent.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Circuit-breaker decorator around the provider gateway.
 *
 * Only a circuit breaker, no retry: a failed reasoning step aborts the turn and the
 * caller resends it whole. When the circuit is open, calls fail fast with a GatewayException.
 *
 * Circuit breaker config (application.yml, instance "reasoningGateway"):
 * - opens after 50% failures in a sliding window of 10 calls
 * - waits 30s before half-open probe calls
 * - slow calls (>30s) count as failures
 */
@Component
@Primary
@Slf4j
public class ResilientReasoningGateway implements ReasoningGateway {

    private final ReasoningGateway delegate;

    public ResilientReasoningGateway(@Qualifier("providerGateway") ReasoningGateway delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "reasoningGateway", fallbackMethod = "circuitBreakerFallback")
    public Decision decide(List<Message> history, List<CapabilityDefinition> capabilities) {
        return delegate.decide(history, capabilities);
    }

    public Decision circuitBreakerFallback(List<Message> history,
                                           List<CapabilityDefinition> capabilities,
                                           CallNotPermittedException ex) {
        log.error("Reasoning gateway circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new GatewayException("Reasoning service temporarily disabled after repeated failures", ex);
    }
}
