package com.example.pdp.enforcer.log;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.config.properties.DecisionLogProperties;
import com.example.pdp.engine.EngineResult;
import com.example.pdp.enforcer.model.QueryType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Writes one structured JSON line per decision to the {@code PDP_DECISION} logger.
 */
@Service
public class DecisionLogService {

    public static final String LOGGER_NAME = "PDP_DECISION";

    private static final Logger DECISION_LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private static final int MAX_REASON_LENGTH = 500;

    private final ObjectMapper objectMapper;
    private final boolean debugInfo;

    public DecisionLogService(ObjectMapper objectMapper, DecisionLogProperties properties) {
        this.objectMapper = objectMapper;
        this.debugInfo = properties.debugInfo();
    }

    /**
     * Logs an answered decision.
     *
     * @param summary short form of the query, e.g. {@code (user, action, type)}
     */
    public void logDecision(
            @NonNull QueryType type,
            @NonNull String summary,
            boolean allowed,
            boolean cached,
            @Nullable Object input,
            @Nullable JsonNode debug,
            @NonNull String correlationId) {

        DecisionLogEvent event = new DecisionLogEvent(
                Instant.now(),
                correlationId,
                type.tag(),
                "is allowed = " + allowed + " | " + StringSanitizer.forLog(summary),
                allowed ? DecisionLogEvent.Outcome.ALLOW : DecisionLogEvent.Outcome.DENY,
                cached,
                null,
                null,
                debugInfo ? toTree(input) : null,
                debugInfo ? debug : null);

        logEvent(event);
    }

    /**
     * Logs a decision answered with a fallback because the engine call failed.
     */
    public void logFallback(
            @NonNull QueryType type,
            @NonNull String summary,
            @NonNull EngineResult.Failure failure,
            @Nullable Object input,
            @NonNull String correlationId) {

        DecisionLogEvent event = new DecisionLogEvent(
                Instant.now(),
                correlationId,
                type.tag(),
                "is allowed = false | " + StringSanitizer.forLog(summary),
                DecisionLogEvent.Outcome.FALLBACK,
                false,
                failure.kind().tagValue(),
                StringSanitizer.forLog(failure.message(), MAX_REASON_LENGTH),
                debugInfo ? toTree(input) : null,
                null);

        logEvent(event);
    }

    private void logEvent(@NonNull DecisionLogEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            DECISION_LOG.error("Failed to serialize decision event: {}", StringSanitizer.forLog(e.getMessage()));
            DECISION_LOG.warn("{} outcome={} type={} correlationId={}",
                    event.message(), event.outcome(), event.queryType(), event.correlationId());
        }
    }

    private void logByOutcome(DecisionLogEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> DECISION_LOG.info(json);
            case DENY, FALLBACK -> DECISION_LOG.warn(json);
        }
    }

    @Nullable
    private JsonNode toTree(@Nullable Object input) {
        if (input == null) {
            return null;
        }
        try {
            return objectMapper.valueToTree(input);
        } catch (IllegalArgumentException e) {
            DECISION_LOG.debug("Decision input is not serializable: {}", StringSanitizer.forLog(e.getMessage()));
            return null;
        }
    }
}
