package org.javai.restcore.http;

import java.util.Map;
import org.javai.restcore.PreparedRequest;

/**
 * Performs one network call. Any network fault is reported as a
 * {@link org.javai.restcore.exception.RequestException} carrying the original cause.
 */
@FunctionalInterface
public interface TransportCall {

    /**
     * Sends the request with the given extra headers.
     *
     * @param request the prepared request
     * @param headers headers to add, typically {@code Authorization}
     * @return the response, whatever its status
     */
    Response request(PreparedRequest request, Map<String, String> headers);
}
