package org.javai.restcore.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An HTTP response as returned by a {@link Requestor}.
 *
 * <p>Header names are matched case-insensitively. The body is never null; an absent body is
 * represented by an empty array.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers, unmodifiable
 * @param body the raw response body
 */
public record Response(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public Response {
        Objects.requireNonNull(headers, "headers must not be null");
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body.clone();
    }

    /**
     * Creates a response with single-valued headers and a UTF-8 body.
     */
    public static Response of(int statusCode, Map<String, String> headers, String body) {
        Map<String, List<String>> multi = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, value) -> multi.put(name, List.of(value)));
        return new Response(statusCode, multi, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the first value of the named header.
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Response[statusCode=" + statusCode + ", headers=" + headers + ", bodyLength=" + body.length + "]";
    }
}
