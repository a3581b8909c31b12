package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised for a {@code 451 Unavailable For Legal Reasons} response. */
public class UnavailableForLegalReasonsException extends ResponseException {

    public UnavailableForLegalReasonsException(Response response) {
        super(response);
    }
}
