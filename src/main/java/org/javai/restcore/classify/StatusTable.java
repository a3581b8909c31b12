package org.javai.restcore.classify;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.javai.restcore.exception.AuthorizationException;
import org.javai.restcore.exception.BadRequestException;
import org.javai.restcore.exception.ConflictException;
import org.javai.restcore.exception.NotFoundException;
import org.javai.restcore.exception.RedirectException;
import org.javai.restcore.exception.ResponseException;
import org.javai.restcore.exception.ServerErrorException;
import org.javai.restcore.exception.SpecialErrorException;
import org.javai.restcore.exception.TooLargeException;
import org.javai.restcore.exception.TooManyRequestsException;
import org.javai.restcore.exception.UnavailableForLegalReasonsException;
import org.javai.restcore.exception.UriTooLongException;
import org.javai.restcore.http.Response;

/**
 * The status tables shared by every session.
 */
public final class StatusTable {

    public static final int NO_CONTENT = 204;
    public static final int UNAUTHORIZED = 401;

    /** Statuses retried while attempts remain. 520 and 522 are Cloudflare's. */
    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(500, 502, 503, 504, 408, 520, 522);

    public static final Set<Integer> SUCCESS_STATUSES = Set.of(200, 201, 202);

    private static final Map<Integer, Function<Response, ResponseException>> STATUS_EXCEPTIONS = Map.ofEntries(
            Map.entry(301, RedirectException::new),
            Map.entry(302, RedirectException::new),
            Map.entry(400, BadRequestException::new),
            Map.entry(401, AuthorizationException::forResponse),
            Map.entry(403, AuthorizationException::forResponse),
            Map.entry(404, NotFoundException::new),
            Map.entry(409, ConflictException::new),
            Map.entry(413, TooLargeException::new),
            Map.entry(414, UriTooLongException::new),
            Map.entry(415, SpecialErrorException::new),
            Map.entry(420, TooManyRequestsException::new),
            Map.entry(429, TooManyRequestsException::new),
            Map.entry(451, UnavailableForLegalReasonsException::new),
            Map.entry(500, ServerErrorException::new),
            Map.entry(502, ServerErrorException::new),
            Map.entry(503, ServerErrorException::new),
            Map.entry(504, ServerErrorException::new),
            Map.entry(520, ServerErrorException::new),
            Map.entry(522, ServerErrorException::new)
    );

    private StatusTable() {
        // Utility class
    }

    public static boolean isRetryable(int status) {
        return RETRYABLE_STATUSES.contains(status);
    }

    public static boolean isSuccess(int status) {
        return SUCCESS_STATUSES.contains(status);
    }

    public static boolean hasException(int status) {
        return STATUS_EXCEPTIONS.containsKey(status);
    }

    /**
     * Builds the error for the status of the given response, if the status maps to one.
     */
    public static Optional<ResponseException> exceptionFor(Response response) {
        Function<Response, ResponseException> factory = STATUS_EXCEPTIONS.get(response.statusCode());
        return factory == null ? Optional.empty() : Optional.of(factory.apply(response));
    }
}
