package org.javai.restcore.exception;

import org.javai.restcore.http.Response;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TooManyRequestsExceptionTest {

    @Test
    void message_withRetryAfter_tellsCallerHowLongToWait() {
        TooManyRequestsException exception = new TooManyRequestsException(
                Response.of(429, Map.of("retry-after", "30"), "Too Many Requests"));

        assertThat(exception).hasMessage(
                "received 429 HTTP response. Please wait at least 30.0 seconds before re-trying this request.");
        assertThat(exception.retryAfter()).contains("30");
        assertThat(exception.bodyMessage()).isEqualTo("Too Many Requests");
    }

    @Test
    void message_withHttpDateRetryAfter_showsValueAsReceived() {
        TooManyRequestsException exception = new TooManyRequestsException(
                Response.of(429, Map.of("Retry-After", "Wed, 21 Oct 2026 07:28:00 GMT"), ""));

        assertThat(exception.getMessage()).contains("at least Wed, 21 Oct 2026 07:28:00 GMT seconds");
    }

    @Test
    void message_withoutRetryAfter_isPlain() {
        TooManyRequestsException exception = new TooManyRequestsException(Response.of(420, Map.of(), "<html/>"));

        assertThat(exception).hasMessage("received 420 HTTP response");
        assertThat(exception.retryAfter()).isEmpty();
        assertThat(exception.bodyMessage()).isEqualTo("<html/>");
    }
}
