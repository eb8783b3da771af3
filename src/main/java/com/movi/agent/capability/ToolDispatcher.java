package com.movi.agent.capability;

import com.movi.agent.model.CapabilityCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Executes approved capability calls and normalizes each outcome into an observation string.
 *
 * Handler failures never abort the turn: they come back as "ERROR: ..." observations
 * tagged to the failing call, and the next reasoning step decides what to do.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private final CapabilityRegistry registry;

    public ToolDispatcher(CapabilityRegistry registry) {
        this.registry = registry;
    }

    /**
     * Dispatches a single call and returns the observation string.
     */
    public String execute(CapabilityCall call) {
        Optional<Capability> capability = registry.find(call.getName());

        if (capability.isEmpty()) {
            String msg = String.format(
                    "ERROR: Unknown capability '%s'. Available capabilities: %s",
                    call.getName(), registry.names()
            );
            log.warn(msg);
            return msg;
        }

        log.info("Executing capability: [{}] with args: {}", call.getName(), call.getArguments());

        try {
            String result = capability.get().execute(call.getArguments());
            log.debug("Capability [{}] returned: {}", call.getName(), result);
            return result != null ? result : "";
        } catch (Exception e) {
            log.error("Capability [{}] failed [callId={}]", call.getName(), call.getId(), e);
            return "ERROR: Capability execution failed: " + e.getMessage();
        }
    }
}
