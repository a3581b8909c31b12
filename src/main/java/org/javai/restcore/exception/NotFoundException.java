package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised for a {@code 404 Not Found} response. */
public class NotFoundException extends ResponseException {

    public NotFoundException(Response response) {
        super(response);
    }
}
