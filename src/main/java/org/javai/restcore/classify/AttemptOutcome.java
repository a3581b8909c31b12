package org.javai.restcore.classify;

import java.util.Objects;
import org.javai.restcore.exception.RequestException;
import org.javai.restcore.http.Response;

/**
 * What one attempt produced: either a {@link Responded response} or a {@link TransportFailed
 * transport fault}, never both.
 */
public sealed interface AttemptOutcome permits AttemptOutcome.Responded, AttemptOutcome.TransportFailed {

    /**
     * The server answered, whatever the status.
     *
     * @param response the response
     */
    record Responded(Response response) implements AttemptOutcome {
        public Responded {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public String describeCause() {
            return String.valueOf(response.statusCode());
        }
    }

    /**
     * The network call itself failed.
     *
     * @param exception the transport fault, with its original cause
     */
    record TransportFailed(RequestException exception) implements AttemptOutcome {
        public TransportFailed {
            Objects.requireNonNull(exception, "exception must not be null");
        }

        @Override
        public String describeCause() {
            return String.valueOf(exception.originalCause());
        }
    }

    static AttemptOutcome responded(Response response) {
        return new Responded(response);
    }

    static AttemptOutcome failed(RequestException exception) {
        return new TransportFailed(exception);
    }

    /**
     * The status code, or the original fault, for log messages.
     */
    String describeCause();
}
