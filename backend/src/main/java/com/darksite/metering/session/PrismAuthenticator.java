package com.darksite.metering.session;

import com.darksite.metering.adapters.HttpErrorClassifier;
import com.darksite.metering.config.MeteringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Performs the login call against the control plane.
 *
 * AUTHENTICATION:
 * A GET on the current-user endpoint with basic credentials both validates
 * them and issues a session cookie. Generations that use session tokens send
 * the cookie back; the others keep sending basic credentials.
 */
@Component
@Slf4j
public class PrismAuthenticator {

    static final String LOGIN_PATH = "/api/nutanix/v3/users/me";

    private final RestTemplate restTemplate;
    private final MeteringProperties.Prism prism;
    private final Clock clock;

    public PrismAuthenticator(RestTemplate restTemplate, MeteringProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.prism = properties.getPrism();
        this.clock = clock;
    }

    /**
     * Log in once.
     *
     * @return a fresh credential
     * @throws com.darksite.metering.adapters.MeteringException AUTH when rejected, TRANSIENT or PERMANENT otherwise
     */
    public Credential authenticate() {
        var headers = new HttpHeaders();
        headers.setBasicAuth(prism.getUsername(), prism.getPassword());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(prism.baseUrl() + LOGIN_PATH, HttpMethod.GET,
                    new HttpEntity<>(headers), String.class);
        } catch (RestClientException e) {
            throw HttpErrorClassifier.classify(LOGIN_PATH, e);
        }

        String token = sessionCookie(response.getHeaders().get(HttpHeaders.SET_COOKIE));
        Instant now = clock.instant();
        log.info("Authenticated to {} as {} ({})", prism.getHost(), prism.getUsername(),
                token != null ? "session token issued" : "basic credentials only");
        return new Credential(prism.getHost(), prism.getUsername(), prism.getPassword(),
                token, now, now.plus(prism.getSessionTtl()));
    }

    /**
     * Keeps only the {@code name=value} part of each Set-Cookie header.
     */
    static String sessionCookie(List<String> setCookies) {
        if (setCookies == null || setCookies.isEmpty()) {
            return null;
        }
        String cookie = setCookies.stream()
                .map(header -> header.split(";", 2)[0].trim())
                .filter(pair -> pair.contains("="))
                .collect(Collectors.joining("; "));
        return cookie.isEmpty() ? null : cookie;
    }
}
