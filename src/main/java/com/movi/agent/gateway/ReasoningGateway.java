package com.movi.agent.gateway;

import com.movi.agent.capability.CapabilityDefinition;
import com.movi.agent.model.Decision;
import com.movi.agent.model.Message;

import java.util.List;

public interface ReasoningGateway {

    /**
     * Send the full conversation history and the capability schemas to the reasoning service.
     *
     * @param history      full conversation so far (system + user + assistant + tool results)
     * @param capabilities capabilities the service may choose to invoke
     * @return either a final reply or a batch of capability calls
     * @throws com.movi.agent.exception.GatewayException when the service is unreachable, times out,
     *                                                   or returns output that cannot be parsed
     */
    Decision decide(List<Message> history, List<CapabilityDefinition> capabilities);
}
