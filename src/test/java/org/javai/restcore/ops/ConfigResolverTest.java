package org.javai.restcore.ops;

import org.javai.restcore.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConfigResolverTest {

	@Test
	void resolve_systemPropertyWinsOverEnvironment() {
		ConfigResolver resolver = ConfigResolver.of(
				Map.of("app.key", "from-property")::get,
				Map.of("APP_KEY", "from-env")::get);

		assertThat(resolver.resolve("app.key", "APP_KEY")).contains("from-property");
	}

	@Test
	void resolve_blankPropertyFallsBackToEnvironment() {
		ConfigResolver resolver = ConfigResolver.of(
				Map.of("app.key", "  ")::get,
				Map.of("APP_KEY", " from-env ")::get);

		assertThat(resolver.resolve("app.key", "APP_KEY")).contains("from-env");
	}

	@Test
	void resolveOrDefault_nothingSet_returnsDefault() {
		ConfigResolver resolver = ConfigResolver.of(name -> null, name -> null);

		assertThat(resolver.resolve("app.key", "APP_KEY")).isEmpty();
		assertThat(resolver.resolveOrDefault("app.key", "APP_KEY", "fallback")).isEqualTo("fallback");
	}

	@Test
	void require_nothingSet_namesBothSources() {
		ConfigResolver resolver = ConfigResolver.of(name -> null, name -> null);

		assertThatThrownBy(() -> resolver.require("app.key", "APP_KEY"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("app.key")
				.hasMessageContaining("APP_KEY");
	}
}
