package org.javai.restcore;

import java.time.Duration;
import java.util.Objects;
import org.javai.restcore.exception.ConfigurationException;
import org.javai.restcore.http.HttpClientRequestor;
import org.javai.restcore.ops.ConfigResolver;
import org.javai.restcore.retry.FiniteRetryStrategy;

/**
 * Settings of a session and its transport.
 *
 * <p>{@link #fromEnvironment()} reads each value from a system property, falling back to an
 * environment variable:
 * <ul>
 *   <li>{@code restcore.user.agent} / {@code RESTCORE_USER_AGENT} - user agent (required)</li>
 *   <li>{@code restcore.oauth.url} / {@code RESTCORE_OAUTH_URL} - API base URL</li>
 *   <li>{@code restcore.timeout} / {@code RESTCORE_TIMEOUT} - transport timeout in seconds</li>
 *   <li>{@code restcore.retries} / {@code RESTCORE_RETRIES} - attempts per request</li>
 * </ul>
 *
 * @param userAgent the user agent sent with every request
 * @param oauthUrl the base URL request paths are resolved against
 * @param timeout the default transport timeout
 * @param retries the number of attempts per request
 */
public record SessionConfig(String userAgent, String oauthUrl, Duration timeout, int retries) {

    public SessionConfig {
        Objects.requireNonNull(userAgent, "userAgent must not be null");
        Objects.requireNonNull(oauthUrl, "oauthUrl must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("timeout must be positive, was: " + timeout);
        }
        if (retries < 1) {
            throw new ConfigurationException("retries must be >= 1, was: " + retries);
        }
    }

    public static SessionConfig of(String userAgent) {
        return new SessionConfig(userAgent, HttpClientRequestor.DEFAULT_OAUTH_URL,
                HttpClientRequestor.DEFAULT_TIMEOUT, FiniteRetryStrategy.DEFAULT_RETRIES);
    }

    public static SessionConfig fromEnvironment() {
        return from(ConfigResolver.system());
    }

    static SessionConfig from(ConfigResolver resolver) {
        String userAgent = resolver.require("restcore.user.agent", "RESTCORE_USER_AGENT");
        String oauthUrl = resolver.resolveOrDefault("restcore.oauth.url", "RESTCORE_OAUTH_URL",
                HttpClientRequestor.DEFAULT_OAUTH_URL);
        Duration timeout = resolver.resolve("restcore.timeout", "RESTCORE_TIMEOUT")
                .map(SessionConfig::parseSeconds)
                .orElse(HttpClientRequestor.DEFAULT_TIMEOUT);
        int retries = resolver.resolve("restcore.retries", "RESTCORE_RETRIES")
                .map(SessionConfig::parseRetries)
                .orElse(FiniteRetryStrategy.DEFAULT_RETRIES);
        return new SessionConfig(userAgent, oauthUrl, timeout, retries);
    }

    private static Duration parseSeconds(String value) {
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("timeout must be a number of seconds, was: " + value, e);
        }
    }

    private static int parseRetries(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("retries must be an integer, was: " + value, e);
        }
    }
}
