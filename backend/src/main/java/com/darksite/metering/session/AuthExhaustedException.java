package com.darksite.metering.session;

import com.darksite.metering.adapters.ErrorCategory;
import com.darksite.metering.adapters.MeteringException;

/**
 * Raised once the configured number of consecutive authentication failures is reached.
 */
public class AuthExhaustedException extends MeteringException {

    public AuthExhaustedException(int attempts, Throwable lastFailure) {
        super(ErrorCategory.AUTH_EXHAUSTED,
                "Authentication failed " + attempts + " consecutive times", lastFailure);
    }
}
