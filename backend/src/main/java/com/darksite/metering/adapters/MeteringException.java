package com.darksite.metering.adapters;

/**
 * Classified failure raised while talking to the control plane.
 *
 * Never escapes a collection cycle: the aggregator converts it into
 * snapshot status.
 */
public class MeteringException extends RuntimeException {

    private final ErrorCategory category;
    private final int httpStatus;

    public MeteringException(ErrorCategory category, String message) {
        this(category, message, null, 0);
    }

    public MeteringException(ErrorCategory category, String message, Throwable cause) {
        this(category, message, cause, 0);
    }

    public MeteringException(ErrorCategory category, String message, Throwable cause, int httpStatus) {
        super(message, cause);
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * HTTP status of the failed response, 0 when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isNotFound() {
        return httpStatus == 404;
    }

    /**
     * Short form used in snapshot status and logs.
     */
    public String describe() {
        return category + ": " + getMessage();
    }
}
