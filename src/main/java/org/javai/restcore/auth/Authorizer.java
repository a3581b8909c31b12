package org.javai.restcore.auth;

/**
 * Supplies the bearer token sent with every request.
 *
 * <p>An authorizer is shared by every request of a session and possibly by several threads;
 * implementations guard their own state.
 */
public interface Authorizer {

    /**
     * Whether a usable access token is currently held.
     */
    boolean isValid();

    /**
     * The current access token, or null when none is held.
     */
    String accessToken();

    /**
     * Forgets the current access token, typically after the server rejected it.
     */
    void clearAccessToken();
}
