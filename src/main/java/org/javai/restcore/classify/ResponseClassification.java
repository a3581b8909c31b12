package org.javai.restcore.classify;

/**
 * What a session does with the outcome of one attempt.
 */
public enum ResponseClassification {
    /** 200, 201 or 202: the body is decoded and returned. */
    SUCCESS,

    /** 204: nothing is returned. */
    NO_CONTENT,

    /** 401 with a refreshable authorizer: the token is refreshed and the request retried. */
    AUTH_EXPIRED,

    /** A transient server status with attempts remaining. */
    RETRYABLE_STATUS,

    /** A transient network fault with attempts remaining. */
    RETRYABLE_TRANSPORT_ERROR,

    /** A status mapped to an error of the taxonomy. */
    TERMINAL_STATUS,

    /** A network fault that is not transient, or that struck the last attempt. */
    TERMINAL_TRANSPORT_ERROR,

    /** A status the client knows nothing about. */
    UNEXPECTED_STATUS;

    /**
     * Whether the session makes another attempt.
     */
    public boolean isRetry() {
        return this == AUTH_EXPIRED || this == RETRYABLE_STATUS || this == RETRYABLE_TRANSPORT_ERROR;
    }
}
