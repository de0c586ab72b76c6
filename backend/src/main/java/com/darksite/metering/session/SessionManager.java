package com.darksite.metering.session;

import com.darksite.metering.adapters.MeteringException;
import com.darksite.metering.adapters.OutboundRateLimiter;
import com.darksite.metering.adapters.RetryPolicy;
import com.darksite.metering.config.MeteringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns credential state and the reauthentication policy.
 *
 * CONTRACT:
 * - {@link #acquire()} returns a usable credential, logging in again when the
 *   previous one expired or was rejected
 * - {@link #invalidate(String)} forces a login on next use
 * - after the configured number of consecutive login failures the manager
 *   latches into an exhausted state and fails fast until a cycle begins while
 *   no other cycle is in flight
 *
 * Login calls are rate limited and backed off like data calls.
 */
@Component
@Slf4j
public class SessionManager {

    private final PrismAuthenticator authenticator;
    private final OutboundRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int maxConsecutiveFailures;

    private final AtomicInteger reauthentications = new AtomicInteger();

    private Credential current;
    private String invalidationReason;
    private boolean exhausted;
    private int activeCycles;

    public SessionManager(PrismAuthenticator authenticator, OutboundRateLimiter rateLimiter,
                          RetryPolicy retryPolicy, Clock clock, MeteringProperties properties) {
        this.authenticator = authenticator;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.maxConsecutiveFailures = properties.getAuth().getMaxConsecutiveFailures();
    }

    /**
     * Return a usable credential, logging in if needed.
     *
     * @throws AuthExhaustedException when login failed the configured number of consecutive times
     */
    public synchronized Credential acquire() {
        if (exhausted) {
            throw new AuthExhaustedException(maxConsecutiveFailures, null);
        }
        if (current != null && !current.isExpired(clock.instant())) {
            return current;
        }

        boolean refreshing = current != null || invalidationReason != null;
        if (current != null) {
            log.info("Session for {} expired at {}, logging in again", current.host(), current.expiresAt());
        }

        MeteringException lastFailure = null;
        for (int attempt = 1; attempt <= maxConsecutiveFailures; attempt++) {
            if (attempt > 1 || refreshing) {
                reauthentications.incrementAndGet();
            }
            if (attempt > 1) {
                retryPolicy.backoff(attempt - 1);
            }
            rateLimiter.acquire();
            try {
                current = authenticator.authenticate();
                invalidationReason = null;
                return current;
            } catch (MeteringException e) {
                lastFailure = e;
                log.warn("Login attempt {}/{} failed: {}", attempt, maxConsecutiveFailures, e.describe());
            }
        }

        current = null;
        exhausted = true;
        log.error("Authentication exhausted after {} consecutive failures; adapters stop until the next cycle",
                maxConsecutiveFailures);
        throw new AuthExhaustedException(maxConsecutiveFailures, lastFailure);
    }

    /**
     * Drop the current credential; the next {@link #acquire()} logs in again.
     */
    public synchronized void invalidate(String reason) {
        if (current != null) {
            log.info("Invalidating session for {}: {}", current.host(), reason);
        }
        current = null;
        invalidationReason = reason;
    }

    /**
     * Register a starting cycle. The exhausted latch is cleared only when no other
     * cycle is in flight, so overlapping cycles never reset each other's state.
     */
    public synchronized void beginCycle() {
        activeCycles++;
        if (activeCycles > 1) {
            return;
        }
        if (exhausted) {
            log.info("Clearing exhausted authentication state for new cycle");
        }
        exhausted = false;
    }

    /**
     * Register the end of a cycle started with {@link #beginCycle()}.
     */
    public synchronized void endCycle() {
        if (activeCycles > 0) {
            activeCycles--;
        }
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    /**
     * Logins made because a previous credential or login attempt was rejected or expired.
     */
    public int getReauthenticationCount() {
        return reauthentications.get();
    }
}
