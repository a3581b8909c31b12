package org.javai.restcore.exception;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;

class RequestExceptionTest {

    @Test
    void originalCause_isKeptWithRequestDetails() {
        SocketTimeoutException cause = new SocketTimeoutException("Read timed out");

        RequestException exception = new RequestException(cause, "GET", "https://oauth.reddit.com/api/v1/me");

        assertThat(exception.originalCause()).isSameAs(cause);
        assertThat(exception.method()).isEqualTo("GET");
        assertThat(exception.url()).isEqualTo("https://oauth.reddit.com/api/v1/me");
        assertThat(exception.getMessage()).startsWith("error with request ").contains("Read timed out");
        assertThat(exception).isInstanceOf(RestCoreException.class);
    }
}
