package org.javai.restcore.ops.log4j;

import org.apache.logging.log4j.Level;
import org.javai.restcore.classify.ResponseClassification;
import org.javai.restcore.exception.InvalidTokenException;
import org.javai.restcore.http.Response;
import org.javai.restcore.ops.RequestFailure;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	@Test
	void levelFor_transportFault_isError() {
		RequestFailure failure = new RequestFailure("GET", "https://h/x",
				ResponseClassification.TERMINAL_TRANSPORT_ERROR, null, new SocketTimeoutException(), Instant.now());

		assertThat(Log4jOpReporter.levelFor(failure)).isEqualTo(Level.ERROR);
	}

	@Test
	void levelFor_serverError_isError() {
		assertThat(Log4jOpReporter.levelFor(failure(503, ResponseClassification.TERMINAL_STATUS))).isEqualTo(Level.ERROR);
	}

	@Test
	void levelFor_unexpectedStatus_isError() {
		assertThat(Log4jOpReporter.levelFor(failure(418, ResponseClassification.UNEXPECTED_STATUS))).isEqualTo(Level.ERROR);
	}

	@Test
	void levelFor_authorizationFailures_areWarn() {
		assertThat(Log4jOpReporter.levelFor(failure(401, ResponseClassification.TERMINAL_STATUS))).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(failure(403, ResponseClassification.TERMINAL_STATUS))).isEqualTo(Level.WARN);
	}

	@Test
	void levelFor_otherClientErrors_areInfo() {
		assertThat(Log4jOpReporter.levelFor(failure(404, ResponseClassification.TERMINAL_STATUS))).isEqualTo(Level.INFO);
		assertThat(Log4jOpReporter.levelFor(failure(302, ResponseClassification.TERMINAL_STATUS))).isEqualTo(Level.INFO);
	}

	@Test
	void reporting_doesNotThrow() {
		Log4jOpReporter reporter = new Log4jOpReporter();
		RequestFailure failure = failure(401, ResponseClassification.TERMINAL_STATUS)
				.withException(new InvalidTokenException(Response.of(401, Map.of(), "")));

		assertThatCode(() -> {
			reporter.report(failure);
			reporter.reportRetryAttempt(failure, 1, Duration.ofMillis(500));
			reporter.reportRetryExhausted(failure, 3);
		}).doesNotThrowAnyException();
	}

	private static RequestFailure failure(int status, ResponseClassification classification) {
		return new RequestFailure("GET", "https://oauth.reddit.com/x", classification, status, null, Instant.now());
	}
}
