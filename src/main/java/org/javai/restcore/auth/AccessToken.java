package org.javai.restcore.auth;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * A bearer token as issued by the authorization server.
 *
 * @param value the token
 * @param expiresIn lifetime from the moment of issue, or null if it does not expire
 * @param scopes the granted scopes
 */
public record AccessToken(String value, Duration expiresIn, Set<String> scopes) {

    public AccessToken {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public static AccessToken of(String value, Duration expiresIn) {
        return new AccessToken(value, expiresIn, Set.of());
    }
}
