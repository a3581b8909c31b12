package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/**
 * Raised when a successful response carries a body that is not valid JSON.
 */
public class MalformedPayloadException extends ResponseException {

    public MalformedPayloadException(Response response, Throwable cause) {
        super(response, "received " + response.statusCode() + " HTTP response with a body that is not valid JSON", cause);
    }
}
