package com.vidnyan.kpolicy.domain.error;

/**
 * Base type for errors raised by the policy engine.
 */
public class PolicyEngineException extends RuntimeException {

    public PolicyEngineException(String message) {
        super(message);
    }

    public PolicyEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
