package com.movi.agent.config;

import com.movi.agent.capability.impl.RemoveVehicleFromTripCapability;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the turn state machine.
 * Bound from application.yml under the "movi.orchestrator" prefix.
 */
@Component
@ConfigurationProperties(prefix = "movi.orchestrator")
@Data
public class OrchestratorProperties {

    /** Dispatch → reasoning rounds allowed per turn before the turn fails */
    private int maxToolIterations = 8;

    /** The one capability gated by the consequence check */
    private String dangerousCapability = RemoveVehicleFromTripCapability.NAME;

    /** Argument of the dangerous call naming the targeted entity */
    private String targetArgument = "trip_id";

    /**
     * Replies containing any of these (case-insensitive) confirm a paused action.
     * Plain substring match: "yes but not now" also confirms.
     */
    private List<String> affirmativeTokens = new ArrayList<>(List.of("yes", "proceed"));

    /** How long a turn waits for another turn on the same thread to finish */
    private long lockTimeoutSeconds = 30;

    /**
     * Expiry of the cross-instance turn lease in Redis. Must outlast the slowest turn,
     * otherwise a second instance may start the same thread's next turn early.
     */
    private long leaseTtlSeconds = 300;
}
