package org.javai.restcore.exception;

import java.util.Objects;
import org.javai.restcore.http.Response;

/**
 * Base class for errors raised because of the HTTP status of a response.
 * The offending response stays attached for inspection.
 */
public class ResponseException extends RestCoreException {

    private final transient Response response;

    public ResponseException(Response response) {
        this(response, "received " + response.statusCode() + " HTTP response");
    }

    protected ResponseException(Response response, String message) {
        super(message);
        this.response = Objects.requireNonNull(response, "response must not be null");
    }

    protected ResponseException(Response response, String message, Throwable cause) {
        super(message, cause);
        this.response = Objects.requireNonNull(response, "response must not be null");
    }

    public Response response() {
        return response;
    }

    public int statusCode() {
        return response.statusCode();
    }
}
