package org.javai.restcore.auth;

import java.io.IOException;

/**
 * Issues access tokens. This is where an OAuth grant (refresh token, client credentials,
 * password) plugs in.
 */
@FunctionalInterface
public interface TokenSource {

    AccessToken obtain() throws IOException;
}
