package com.darksite.metering.adapters;

/**
 * Error taxonomy shared by the session manager, adapters and aggregator.
 */
public enum ErrorCategory {
    /**
     * Credential rejected by the control plane; the session is refreshed once.
     */
    AUTH,

    /**
     * Credential refresh failed repeatedly; stops every adapter for the cycle.
     */
    AUTH_EXHAUSTED,

    /**
     * Timeout, 5xx or rate-limit rejection; retried with backoff.
     */
    TRANSIENT,

    /**
     * 4xx other than auth, or a response that does not match the expected schema.
     */
    PERMANENT,

    /**
     * One record missing required fields; dropped and counted.
     */
    RECORD_MALFORMED;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
