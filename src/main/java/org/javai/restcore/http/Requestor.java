package org.javai.restcore.http;

/**
 * The transport used by a {@link org.javai.restcore.Session}: performs HTTP calls and knows the
 * base URL that request paths are resolved against.
 */
public interface Requestor extends TransportCall, AutoCloseable {

    /**
     * The base URL of the authenticated API.
     */
    String oauthUrl();

    /**
     * Releases the underlying connection resources.
     */
    @Override
    void close();
}
