package org.javai.restcore.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.restcore.ops.OpReporter;
import org.javai.restcore.ops.RequestFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports request failures as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.GET /api/v1/me","attemptNumber":1,"delayMs":830,"cause":"503"}
 * }</pre>
 *
 * <p>A failure to write a metric never affects the request being reported.
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.restcore.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger internalLogger = LoggerFactory.getLogger(MetricsOpReporter.class);

	private final ObjectMapper mapper = new ObjectMapper();
	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace prepended to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(RequestFailure failure) {
		ObjectNode event = baseEvent("failure", failure);
		event.put("classification", failure.classification().name());
		if (failure.exception() != null) {
			event.put("error", failure.exception().getClass().getSimpleName());
		}
		emit(event);
	}

	@Override
	public void reportRetryAttempt(RequestFailure failure, int attemptNumber, Duration delay) {
		ObjectNode event = baseEvent("retry_attempt", failure);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(RequestFailure failure, int totalAttempts) {
		ObjectNode event = baseEvent("retry_exhausted", failure);
		event.put("totalAttempts", totalAttempts);
		emit(event);
	}

	String buildTrackingKey(RequestFailure failure) {
		if (namespace == null) {
			return failure.trackingKey();
		}
		return namespace + "." + failure.trackingKey();
	}

	private ObjectNode baseEvent(String eventType, RequestFailure failure) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		event.put("trackingKey", buildTrackingKey(failure));
		event.put("cause", failure.cause());
		if (failure.statusCode() != null) {
			event.put("status", failure.statusCode());
		}
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			internalLogger.debug("Could not emit metrics event {}", event.path("eventType").asText(), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
