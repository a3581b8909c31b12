package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised when the authenticated user is not allowed to access the resource. */
public class ForbiddenException extends AuthorizationException {

    public ForbiddenException(Response response) {
        super(response);
    }
}
