package com.movi.agent.core;

import com.movi.agent.config.OrchestratorProperties;
import com.movi.agent.model.Message;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Interprets the user's reply to a paused action and writes the messages around it.
 *
 * Confirmation is a case-insensitive substring match against a fixed vocabulary
 * (movi.orchestrator.affirmative-tokens). There is no intent parsing: "yes but not now"
 * confirms, and "okay" does not.
 */
@Component
public class ConfirmationGate {

    public static final String CANCELLED_REPLY = "Okay, operation cancelled.";

    private final OrchestratorProperties properties;

    public ConfirmationGate(OrchestratorProperties properties) {
        this.properties = properties;
    }

    public boolean isAffirmative(String userText) {
        if (userText == null || userText.isBlank()) {
            return false;
        }
        String normalized = userText.toLowerCase(Locale.ROOT);
        return properties.getAffirmativeTokens().stream()
                .map(token -> token.toLowerCase(Locale.ROOT).trim())
                .filter(token -> !token.isEmpty())
                .anyMatch(normalized::contains);
    }

    /**
     * System-authored instruction appended after an affirmative reply. It is the only message
     * that lets the dangerous capability skip the consequence check, once, for this entity.
     */
    public Message grant(String entityId) {
        return Message.confirmationGrant(entityId,
                "User confirmed safety check. Execute the removal of vehicle from trip " + entityId + " now.");
    }

    public Message cancellation() {
        return Message.assistant(CANCELLED_REPLY);
    }

    public Message prompt(String warning) {
        return Message.assistant(warning);
    }
}
