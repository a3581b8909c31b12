package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised when the access token is invalid or has expired. */
public class InvalidTokenException extends AuthorizationException {

    public InvalidTokenException(Response response) {
        super(response);
    }
}
