package org.javai.restcore.ops;

import org.javai.restcore.classify.ResponseClassification;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeOpReporterTest {

	private final RequestFailure failure = new RequestFailure("GET", "https://oauth.reddit.com/x",
			ResponseClassification.TERMINAL_STATUS, 404, null, Instant.now());

	@Test
	void report_fansOutToAllReporters() {
		List<String> events = new ArrayList<>();
		OpReporter composite = OpReporter.composite(
				f -> events.add("first"),
				f -> events.add("second"));

		composite.report(failure);

		assertThat(events).containsExactly("first", "second");
	}

	@Test
	void report_failingReporter_doesNotStopOthers() {
		List<String> events = new ArrayList<>();
		OpReporter composite = CompositeOpReporter.of(
				f -> { throw new IllegalStateException("broken"); },
				f -> events.add("reached"));

		assertThatCode(() -> composite.report(failure)).doesNotThrowAnyException();
		assertThat(events).containsExactly("reached");
	}

	@Test
	void retryEvents_areForwarded() {
		List<String> events = new ArrayList<>();
		OpReporter recording = new OpReporter() {
			@Override
			public void report(RequestFailure f) {
				events.add("report");
			}

			@Override
			public void reportRetryAttempt(RequestFailure f, int attemptNumber, Duration delay) {
				events.add("retry:" + attemptNumber);
			}

			@Override
			public void reportRetryExhausted(RequestFailure f, int totalAttempts) {
				events.add("exhausted:" + totalAttempts);
			}
		};
		CompositeOpReporter composite = CompositeOpReporter.builder().add(recording).build();

		composite.reportRetryAttempt(failure, 1, Duration.ofSeconds(1));
		composite.reportRetryExhausted(failure, 3);

		assertThat(events).containsExactly("retry:1", "exhausted:3");
	}

	@Test
	void builder_skipsNullAndDisabledReporters() {
		CompositeOpReporter composite = CompositeOpReporter.builder()
				.add(null)
				.add(OpReporter.noOp())
				.addIf(false, OpReporter.noOp())
				.addIf(true, OpReporter.noOp())
				.addAll(List.of(OpReporter.noOp()))
				.build();

		assertThat(composite.size()).isEqualTo(3);
	}
}
