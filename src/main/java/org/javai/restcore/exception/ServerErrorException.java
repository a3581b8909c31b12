package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/**
 * Raised for 5xx responses, including the Cloudflare-specific 520 and 522.
 *
 * <p>These statuses are retried while attempts remain, so a caller only sees this error
 * for the final failing attempt.
 */
public class ServerErrorException extends ResponseException {

    public ServerErrorException(Response response) {
        super(response);
    }
}
