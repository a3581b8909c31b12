package org.javai.restcore;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The normalized, immutable inputs of one logical request. Built once per
 * {@link Session#request} call and reused unchanged by every attempt.
 *
 * <p>Redirects are never followed for a prepared request.
 *
 * @param method the HTTP verb
 * @param url the absolute URL
 * @param params the query parameters, in the order they are sent
 * @param body the request body
 * @param timeout the transport timeout, or null for the requestor default
 */
public record PreparedRequest(
        String method,
        String url,
        Map<String, String> params,
        RequestBody body,
        Duration timeout
) {

    public PreparedRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(params, "params must not be null")));
        Objects.requireNonNull(body, "body must not be null");
    }

    public Optional<Duration> timeoutOverride() {
        return Optional.ofNullable(timeout);
    }
}
