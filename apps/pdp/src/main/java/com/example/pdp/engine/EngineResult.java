package com.example.pdp.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a call to the policy engine. Failures are values, not exceptions, so every caller
 * decides explicitly what a failed call resolves to.
 */
public sealed interface EngineResult permits EngineResult.Success, EngineResult.Failure {

    /**
     * @param result the {@code result} member of the engine response; a missing node when the
     *               queried document is undefined
     */
    record Success(JsonNode result) implements EngineResult {
    }

    record Failure(Kind kind, String message) implements EngineResult {
    }

    enum Kind {
        TIMEOUT,
        CONNECTION,
        BAD_STATUS,
        MALFORMED_RESPONSE;

        public String tagValue() {
            return name().toLowerCase();
        }
    }
}
