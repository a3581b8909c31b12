package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/** Raised for a {@code 414 URI Too Long} response. */
public class UriTooLongException extends ResponseException {

    public UriTooLongException(Response response) {
        super(response);
    }
}
