package org.javai.restcore.exception;

/**
 * Thrown when an authorizer cannot renew its access token.
 */
public class TokenRefreshException extends RestCoreException {

    public TokenRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
