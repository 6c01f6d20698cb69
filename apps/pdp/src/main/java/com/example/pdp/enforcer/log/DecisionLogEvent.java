package com.example.pdp.enforcer.log;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Structured decision log entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionLogEvent(
        // Event metadata
        Instant timestamp,
        String correlationId,
        String queryType,

        // Decision
        String message,
        Outcome outcome,
        boolean cached,
        String failureKind,
        String reason,

        // Payload, only with debug info enabled
        JsonNode input,
        JsonNode debug
) {
    public enum Outcome {
        ALLOW, DENY, FALLBACK
    }
}
