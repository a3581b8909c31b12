package org.javai.restcore.exception;

import java.net.URI;
import org.javai.restcore.http.Response;

/**
 * Raised for 301 and 302 responses. Redirects are never followed automatically; the target
 * path is exposed so the caller can decide what to do.
 */
public class RedirectException extends ResponseException {

    private final String path;

    public RedirectException(Response response) {
        this(response, targetPath(response));
    }

    private RedirectException(Response response, String path) {
        super(response, messageFor(path));
        this.path = path;
    }

    /**
     * The path of the {@code Location} header, without a trailing {@code .json}.
     */
    public String path() {
        return path;
    }

    private static String targetPath(Response response) {
        String location = response.header("location").orElse("");
        String path;
        try {
            path = URI.create(location).getPath();
        } catch (IllegalArgumentException e) {
            path = location;
        }
        if (path == null) {
            path = "";
        }
        return path.endsWith(".json") ? path.substring(0, path.length() - ".json".length()) : path;
    }

    private static String messageFor(String path) {
        String message = "Redirect to " + path;
        if (path.contains("/login/")) {
            message += " (You may be trying to perform a non-read-only action via a read-only instance.)";
        }
        return message;
    }
}
