package org.javai.restcore.exception;

import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.restcore.http.Response;

/**
 * Raised when the server refuses a request because its quota is exhausted (429, or the
 * legacy 420).
 */
public class TooManyRequestsException extends ResponseException {

    // an HTTP-date Retry-After is shown as received
    private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d+)?");

    private final String retryAfter;
    private final String bodyMessage;

    public TooManyRequestsException(Response response) {
        super(response, messageFor(response));
        this.retryAfter = response.header("retry-after").orElse(null);
        // not every throttling response has a JSON body
        this.bodyMessage = response.text();
    }

    /**
     * The raw {@code Retry-After} header, if the server sent one.
     */
    public Optional<String> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * The response body text.
     */
    public String bodyMessage() {
        return bodyMessage;
    }

    private static String messageFor(Response response) {
        String message = "received " + response.statusCode() + " HTTP response";
        Optional<String> retryAfter = response.header("retry-after");
        if (retryAfter.isPresent()) {
            String seconds = retryAfter.get().trim();
            if (DECIMAL.matcher(seconds).matches()) {
                seconds = String.valueOf(Double.parseDouble(seconds));
            }
            message += ". Please wait at least " + seconds + " seconds before re-trying this request.";
        }
        return message;
    }
}
