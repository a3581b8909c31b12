package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised for a {@code 400 Bad Request} response. */
public class BadRequestException extends ResponseException {

    public BadRequestException(Response response) {
        super(response);
    }
}
