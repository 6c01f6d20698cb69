package com.example.pdp.exception;

import com.example.pdp.engine.EngineResult;

/**
 * Raised on paths that have no safe fallback when the policy engine cannot answer.
 */
public class PolicyEngineUnavailableException extends RuntimeException {

    private final EngineResult.Kind kind;

    public PolicyEngineUnavailableException(EngineResult.Failure failure) {
        super(failure.message());
        this.kind = failure.kind();
    }

    public EngineResult.Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "PolicyEngineUnavailableException{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
