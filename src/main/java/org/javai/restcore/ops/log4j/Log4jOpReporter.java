package org.javai.restcore.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.restcore.ops.OpReporter;
import org.javai.restcore.ops.RequestFailure;

import java.time.Duration;

/**
 * Reports request failures using Log4j2.
 *
 * <p>Errors raised to the caller are logged at a level chosen from what went wrong:
 * <ul>
 *   <li>network faults, server errors and unexpected statuses → ERROR</li>
 *   <li>401 and 403 → WARN</li>
 *   <li>other client errors and redirects → INFO</li>
 * </ul>
 * Retries are logged at INFO and exhausted retries at WARN.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.restcore.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(RequestFailure failure) {
		logger.atLevel(levelFor(failure))
			.withMarker(FAILURE_MARKER)
			.log("Request [{} {}] failed: {} | classification={}, cause={}",
				failure.method(),
				failure.url(),
				failure.exception() != null ? failure.exception().getMessage() : "n/a",
				failure.classification(),
				failure.cause());
	}

	@Override
	public void reportRetryAttempt(RequestFailure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying request [{} {}] after attempt {} in {} ms. Cause: {}",
				failure.method(),
				failure.url(),
				attemptNumber,
				delay.toMillis(),
				failure.cause());
	}

	@Override
	public void reportRetryExhausted(RequestFailure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retries exhausted for request [{} {}] after {} attempts. Cause: {}",
				failure.method(),
				failure.url(),
				totalAttempts,
				failure.cause());
	}

	static Level levelFor(RequestFailure failure) {
		Integer status = failure.statusCode();
		if (status == null || status >= 500) {
			return Level.ERROR;
		}
		return switch (failure.classification()) {
			case UNEXPECTED_STATUS -> Level.ERROR;
			case TERMINAL_STATUS -> status == 401 || status == 403 ? Level.WARN : Level.INFO;
			default -> Level.INFO;
		};
	}
}
