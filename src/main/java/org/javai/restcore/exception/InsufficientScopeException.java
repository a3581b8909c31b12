package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised when the access token lacks the scope the resource requires. */
public class InsufficientScopeException extends AuthorizationException {

    public InsufficientScopeException(Response response) {
        super(response);
    }
}
