package org.javai.restcore.exception;

import org.javai.restcore.http.Response;

/**
 * A status the client has no mapping for reached the success branch.
 *
 * <p>This is a defect rather than an operational failure: it means the API contract changed.
 * It is deliberately not a {@link RestCoreException} so that callers handling the regular
 * taxonomy do not absorb it.
 */
public class UnexpectedStatusException extends IllegalStateException {

    private final transient Response response;

    public UnexpectedStatusException(Response response) {
        super("Unexpected status code: " + response.statusCode());
        this.response = response;
    }

    public Response response() {
        return response;
    }
}
