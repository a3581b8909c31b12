package org.javai.restcore.exception;

import java.util.Locale;
import java.util.Optional;
import org.javai.restcore.http.Response;

/**
 * Base class for 401 and 403 responses.
 *
 * <p>The concrete kind comes from the {@code error} parameter of the {@code WWW-Authenticate}
 * header when the server sends one, and from the status code otherwise.
 */
public class AuthorizationException extends ResponseException {

    public AuthorizationException(Response response) {
        super(response);
    }

    /**
     * Builds the authorization error matching the given 401 or 403 response.
     */
    public static AuthorizationException forResponse(Response response) {
        Optional<String> error = authenticateError(response);
        if (error.isPresent()) {
            AuthorizationException byHeader = switch (error.get()) {
                case "insufficient_scope" -> new InsufficientScopeException(response);
                case "invalid_token" -> new InvalidTokenException(response);
                default -> null;
            };
            if (byHeader != null) {
                return byHeader;
            }
        }
        if (response.statusCode() == 403) {
            return new ForbiddenException(response);
        }
        return new InvalidTokenException(response);
    }

    private static Optional<String> authenticateError(Response response) {
        return response.header("www-authenticate").map(value -> {
            String unquoted = value.replace("\"", "");
            int separator = unquoted.lastIndexOf('=');
            return separator < 0 ? "" : unquoted.substring(separator + 1).trim().toLowerCase(Locale.ROOT);
        });
    }
}
