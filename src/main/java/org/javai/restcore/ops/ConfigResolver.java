package org.javai.restcore.ops;

import java.util.Optional;
import java.util.function.Function;
import org.javai.restcore.exception.ConfigurationException;

/**
 * Resolves configuration from a system property first and an environment variable second.
 */
public final class ConfigResolver {

	private final Function<String, String> properties;
	private final Function<String, String> environment;

	private ConfigResolver(Function<String, String> properties, Function<String, String> environment) {
		this.properties = properties;
		this.environment = environment;
	}

	/**
	 * A resolver reading {@link System#getProperty(String)} and {@link System#getenv(String)}.
	 */
	public static ConfigResolver system() {
		return new ConfigResolver(System::getProperty, System::getenv);
	}

	/**
	 * A resolver over explicit lookups, for tests.
	 */
	public static ConfigResolver of(Function<String, String> properties, Function<String, String> environment) {
		return new ConfigResolver(properties, environment);
	}

	/**
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the first non-blank value, if any
	 */
	public Optional<String> resolve(String sysProp, String envVar) {
		String value = properties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * @throws ConfigurationException if neither source is set
	 */
	public String require(String sysProp, String envVar) {
		return resolve(sysProp, envVar).orElseThrow(() -> new ConfigurationException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	public String resolveOrDefault(String sysProp, String envVar, String defaultValue) {
		return resolve(sysProp, envVar).orElse(defaultValue);
	}
}
