package org.javai.restcore.exception;

import java.util.Objects;

/**
 * Wraps a fault raised while performing the network call itself (connect, TLS, DNS, read).
 *
 * <p>The original fault is kept so the retry loop can decide whether it is transient.
 */
public class RequestException extends RestCoreException {

    private final String method;
    private final String url;

    public RequestException(Throwable originalCause, String method, String url) {
        super("error with request " + originalCause, Objects.requireNonNull(originalCause, "originalCause must not be null"));
        this.method = method;
        this.url = url;
    }

    public Throwable originalCause() {
        return getCause();
    }

    public String method() {
        return method;
    }

    public String url() {
        return url;
    }
}
