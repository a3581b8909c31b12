package org.javai.restcore.ratelimit;

import java.util.Map;
import java.util.function.Supplier;
import org.javai.restcore.PreparedRequest;
import org.javai.restcore.http.Response;
import org.javai.restcore.http.TransportCall;

/**
 * Paces outgoing calls. A session calls its rate limiter once per attempt and the rate limiter
 * performs the call.
 *
 * <p>A rate limiter is shared by every request of a session; implementations guard their own
 * bookkeeping.
 */
public interface RateLimiter {

    /**
     * Waits as long as the pacing policy requires, then performs the call.
     *
     * @param transport the call to perform
     * @param headerCallback supplies the headers to send, evaluated right before the call
     * @param request the prepared request
     * @return the response
     */
    Response call(TransportCall transport, Supplier<Map<String, String>> headerCallback, PreparedRequest request);

    /**
     * A rate limiter that never waits.
     */
    static RateLimiter passThrough() {
        return (transport, headerCallback, request) -> transport.request(request, headerCallback.get());
    }
}
