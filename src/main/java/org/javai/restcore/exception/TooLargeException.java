package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised for a {@code 413 Payload Too Large} response. */
public class TooLargeException extends ResponseException {

    public TooLargeException(Response response) {
        super(response);
    }
}
