package com.darksite.metering.session;

import com.darksite.metering.domain.model.ApiGeneration;
import org.springframework.http.HttpHeaders;

import java.time.Instant;

/**
 * Authenticated access to the control plane, owned by {@link SessionManager}.
 *
 * @param host       control plane host the credential is valid for
 * @param principal  user name
 * @param secret     password; never logged
 * @param token      issued session cookie ({@code name=value}), null when none was issued
 * @param issuedAt   when the credential was established
 * @param expiresAt  estimated expiry of the issued token
 */
public record Credential(
        String host,
        String principal,
        String secret,
        String token,
        Instant issuedAt,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    /**
     * Adds the authentication headers a generation expects.
     */
    public void applyTo(HttpHeaders headers, ApiGeneration generation) {
        if (generation.getAuthMode() == ApiGeneration.AuthMode.SESSION_TOKEN && hasToken()) {
            headers.add(HttpHeaders.COOKIE, token);
        } else {
            headers.setBasicAuth(principal, secret);
        }
    }

    @Override
    public String toString() {
        return "Credential{host=" + host + ", principal=" + principal
                + ", token=" + (hasToken() ? "<issued>" : "<none>") + ", expiresAt=" + expiresAt + "}";
    }
}
