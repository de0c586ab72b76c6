package com.darksite.metering.adapters;

import com.google.common.util.concurrent.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * Global cap on outbound requests per second.
 *
 * One instance is shared by every adapter and the session manager. A caller
 * over the limit waits for a permit instead of failing.
 */
@Slf4j
public class OutboundRateLimiter {

    private final RateLimiter rateLimiter;

    public OutboundRateLimiter(double requestsPerSecond) {
        this.rateLimiter = RateLimiter.create(requestsPerSecond);
        log.info("Outbound request limit set to {} requests/second", requestsPerSecond);
    }

    /**
     * Block until a permit is available.
     *
     * @throws MeteringException TRANSIENT if the thread was interrupted while waiting
     */
    public void acquire() {
        double waitedSeconds = rateLimiter.acquire();
        if (waitedSeconds > 0) {
            log.debug("Rate limited outbound request for {} ms", Math.round(waitedSeconds * 1000));
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new MeteringException(ErrorCategory.TRANSIENT, "Interrupted while waiting for a request permit");
        }
    }

    public double getRate() {
        return rateLimiter.getRate();
    }
}
