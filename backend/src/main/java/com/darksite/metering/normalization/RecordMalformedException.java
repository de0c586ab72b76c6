package com.darksite.metering.normalization;

import com.darksite.metering.adapters.ErrorCategory;
import com.darksite.metering.adapters.MeteringException;

/**
 * An adapter record that cannot be identified or parsed. Dropped on its own.
 */
public class RecordMalformedException extends MeteringException {

    private final String reason;

    /**
     * @param reason short, low-cardinality tag used as the drop counter's label
     */
    public RecordMalformedException(String reason, String message) {
        super(ErrorCategory.RECORD_MALFORMED, message);
        this.reason = reason;
    }

    public RecordMalformedException(String reason, String message, Throwable cause) {
        super(ErrorCategory.RECORD_MALFORMED, message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
