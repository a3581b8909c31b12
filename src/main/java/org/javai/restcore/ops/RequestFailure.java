package org.javai.restcore.ops;

import java.time.Instant;
import java.util.Objects;
import org.javai.restcore.PreparedRequest;
import org.javai.restcore.classify.AttemptOutcome;
import org.javai.restcore.classify.ResponseClassification;

/**
 * A failed attempt, with enough context for reporting.
 *
 * @param method the HTTP verb
 * @param url the request URL, without query parameters
 * @param classification how the attempt was classified
 * @param statusCode the response status, or null for a transport fault
 * @param exception the transport fault or the error raised to the caller (may be null)
 * @param occurredAt when the attempt resolved
 */
public record RequestFailure(
        String method,
        String url,
        ResponseClassification classification,
        Integer statusCode,
        Throwable exception,
        Instant occurredAt
) {

    public RequestFailure {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    /**
     * Describes an attempt outcome.
     */
    public static RequestFailure of(PreparedRequest request, AttemptOutcome outcome, ResponseClassification classification) {
        if (outcome instanceof AttemptOutcome.Responded responded) {
            return new RequestFailure(request.method(), request.url(), classification,
                    responded.response().statusCode(), null, Instant.now());
        }
        AttemptOutcome.TransportFailed failed = (AttemptOutcome.TransportFailed) outcome;
        return new RequestFailure(request.method(), request.url(), classification,
                null, failed.exception().originalCause(), Instant.now());
    }

    /**
     * Returns a copy carrying the error raised to the caller.
     */
    public RequestFailure withException(Throwable raised) {
        return new RequestFailure(method, url, classification, statusCode, raised, occurredAt);
    }

    /**
     * The status code, or the fault, that determined the outcome.
     */
    public String cause() {
        if (statusCode != null) {
            return String.valueOf(statusCode);
        }
        return exception == null ? "unknown" : exception.getClass().getName();
    }

    /**
     * A stable key for metrics aggregation, such as {@code GET /api/v1/me}.
     */
    public String trackingKey() {
        return method + " " + path(url);
    }

    private static String path(String url) {
        int scheme = url.indexOf("://");
        int start = scheme < 0 ? 0 : url.indexOf('/', scheme + 3);
        return start < 0 ? "/" : url.substring(start);
    }
}
