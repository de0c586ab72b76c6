package com.darksite.metering.adapters;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps REST client failures onto the error taxonomy.
 *
 * 401/403 are AUTH, 429 and 5xx are TRANSIENT, any other 4xx is PERMANENT.
 * Connection failures and timeouts are TRANSIENT.
 */
public final class HttpErrorClassifier {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private HttpErrorClassifier() {
    }

    public static MeteringException classify(String endpoint, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = "HTTP " + status + " from " + endpoint + ": " + truncate(response.getResponseBodyAsString());
            return new MeteringException(categoryOf(status), message, e, status);
        }
        if (e instanceof ResourceAccessException) {
            return new MeteringException(ErrorCategory.TRANSIENT, "I/O failure calling " + endpoint + ": " + e.getMessage(), e);
        }
        return new MeteringException(ErrorCategory.PERMANENT, "Request to " + endpoint + " failed: " + e.getMessage(), e);
    }

    static ErrorCategory categoryOf(int status) {
        if (status == 401 || status == 403) {
            return ErrorCategory.AUTH;
        }
        if (status == 429 || status >= 500) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.PERMANENT;
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE);
    }
}
