package org.javai.restcore.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Base class holding an access token, its expiry and its scopes.
 * All state is guarded by the instance lock.
 */
public abstract class TokenAuthorizer implements Authorizer {

    private final Clock clock;

    private String accessToken;
    private Instant expiresAt;
    private Set<String> scopes = Set.of();

    protected TokenAuthorizer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized boolean isValid() {
        return accessToken != null && (expiresAt == null || clock.instant().isBefore(expiresAt));
    }

    @Override
    public synchronized String accessToken() {
        return accessToken;
    }

    @Override
    public synchronized void clearAccessToken() {
        accessToken = null;
        expiresAt = null;
        scopes = Set.of();
    }

    public synchronized Set<String> scopes() {
        return scopes;
    }

    /**
     * Stores a freshly issued token. The token is treated as expired {@code earlyExpiry}
     * before the server would reject it.
     */
    protected synchronized void store(AccessToken token, Duration earlyExpiry) {
        Objects.requireNonNull(token, "token must not be null");
        this.accessToken = token.value();
        this.expiresAt = token.expiresIn() == null ? null : clock.instant().plus(token.expiresIn()).minus(earlyExpiry);
        this.scopes = token.scopes();
    }
}
