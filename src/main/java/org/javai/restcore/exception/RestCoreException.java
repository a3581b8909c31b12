package org.javai.restcore.exception;

/**
 * Base class of every error raised by this library.
 *
 * <p>All errors are unchecked: a request either returns its decoded body or throws exactly one
 * error from this hierarchy.
 */
public class RestCoreException extends RuntimeException {

    public RestCoreException(String message) {
        super(message);
    }

    public RestCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
