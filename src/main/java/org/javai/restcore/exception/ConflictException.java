package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised for a {@code 409 Conflict} response. */
public class ConflictException extends ResponseException {

    public ConflictException(Response response) {
        super(response);
    }
}
