package org.javai.restcore.auth;

import java.time.Clock;
import java.time.Duration;

/**
 * Uses a token obtained elsewhere, for example through an implicit grant. It cannot be
 * refreshed: once cleared or expired, requests fail until a new authorizer is supplied.
 */
public final class StaticTokenAuthorizer extends TokenAuthorizer {

    public StaticTokenAuthorizer(String accessToken) {
        this(AccessToken.of(accessToken, null), Clock.systemUTC());
    }

    public StaticTokenAuthorizer(AccessToken token, Clock clock) {
        super(clock);
        store(token, Duration.ZERO);
    }
}
