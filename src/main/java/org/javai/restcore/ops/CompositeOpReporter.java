package org.javai.restcore.ops;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception, it is
 * logged and the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("myapp"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger logger = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(RequestFailure failure) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.report(failure);
			} catch (RuntimeException e) {
				logReporterError("report", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryAttempt(RequestFailure failure, int attemptNumber, Duration delay) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(failure, attemptNumber, delay);
			} catch (RuntimeException e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryExhausted(RequestFailure failure, int totalAttempts) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportRetryExhausted(failure, totalAttempts);
			} catch (RuntimeException e) {
				logReporterError("reportRetryExhausted", reporter, e);
			}
		}
	}

	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, OpReporter reporter, RuntimeException e) {
		logger.warn("OpReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends OpReporter> reporters) {
			for (OpReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Adds the reporter only when the condition holds.
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
