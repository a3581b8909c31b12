package org.javai.restcore.auth;

/**
 * An {@link Authorizer} able to obtain a new access token on its own.
 *
 * <p>A session refreshes such an authorizer before an attempt whenever its token is not valid,
 * and retries a request rejected with 401 once the token has been cleared.
 */
public interface RefreshableAuthorizer extends Authorizer {

    /**
     * Obtains a new access token.
     *
     * @throws org.javai.restcore.exception.TokenRefreshException if the grant cannot be renewed
     */
    void refresh();
}
