package com.darksite.metering.adapters;

import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.session.Credential;
import com.darksite.metering.session.SessionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Shared HTTP access to every API generation.
 *
 * Each request goes through the global rate limiter, carries the credential
 * the session manager hands out, and is retried by the retry policy when it
 * fails transiently. A rejected credential is invalidated and the request is
 * repeated once with a fresh login. All failures leave here classified.
 */
@Component
@Slf4j
public class PrismHttpClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SessionManager sessionManager;
    private final OutboundRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final MeterRegistry meterRegistry;
    private final String baseUrl;

    public PrismHttpClient(RestTemplate restTemplate, ObjectMapper objectMapper, SessionManager sessionManager,
                           OutboundRateLimiter rateLimiter, RetryPolicy retryPolicy, MeterRegistry meterRegistry,
                           MeteringProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.sessionManager = sessionManager;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.baseUrl = properties.getPrism().baseUrl();
    }

    /**
     * GET a JSON document.
     *
     * @param generation API generation, selects base path and auth mode
     * @param endpoint   low-cardinality name for logs and meters
     * @param path       path below the generation's base path
     * @param query      query parameters, may be empty
     */
    public JsonNode get(ApiGeneration generation, String endpoint, String path, Map<String, ?> query) {
        URI uri = buildUri(generation, path, query);
        return execute(generation, endpoint, HttpMethod.GET, uri, null);
    }

    /**
     * POST a JSON body and read a JSON document.
     */
    public JsonNode post(ApiGeneration generation, String endpoint, String path, Object body) {
        URI uri = buildUri(generation, path, Map.of());
        return execute(generation, endpoint, HttpMethod.POST, uri, body);
    }

    private JsonNode execute(ApiGeneration generation, String endpoint, HttpMethod method, URI uri, Object body) {
        return retryPolicy.execute(endpoint, () -> {
            Credential credential = sessionManager.acquire();
            try {
                return send(generation, endpoint, method, uri, body, credential);
            } catch (MeteringException e) {
                if (e.getCategory() != ErrorCategory.AUTH) {
                    throw e;
                }
                sessionManager.invalidate("HTTP " + e.getHttpStatus() + " from " + endpoint);
                return send(generation, endpoint, method, uri, body, sessionManager.acquire());
            }
        });
    }

    private JsonNode send(ApiGeneration generation, String endpoint, HttpMethod method, URI uri,
                          Object body, Credential credential) {
        rateLimiter.acquire();

        var headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setContentType(MediaType.APPLICATION_JSON);
        credential.applyTo(headers, generation);

        Timer.Sample sample = Timer.start(meterRegistry);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            countRequest(endpoint, "error");
            throw HttpErrorClassifier.classify(endpoint, e);
        } finally {
            sample.stop(meterRegistry.timer("metering.api.request.duration", "endpoint", endpoint));
        }
        countRequest(endpoint, "success");
        log.debug("{} {} -> {}", method, uri, response.getStatusCode().value());

        String payload = response.getBody();
        if (payload == null || payload.isBlank()) {
            throw new MeteringException(ErrorCategory.PERMANENT, "Empty response body from " + endpoint);
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MeteringException(ErrorCategory.PERMANENT, "Malformed JSON from " + endpoint, e);
        }
    }

    private URI buildUri(ApiGeneration generation, String path, Map<String, ?> query) {
        var builder = UriComponentsBuilder.fromHttpUrl(baseUrl + generation.getBasePath() + path);
        query.forEach((name, value) -> builder.queryParam(name, value));
        return builder.build().encode().toUri();
    }

    private void countRequest(String endpoint, String status) {
        meterRegistry.counter("metering.api.requests", "endpoint", endpoint, "status", status).increment();
    }
}
