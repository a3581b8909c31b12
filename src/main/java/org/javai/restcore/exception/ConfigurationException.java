package org.javai.restcore.exception;

/**
 * Indicates invalid wiring or invocation, such as a missing authorizer or a conflicting set of
 * request bodies. Raised synchronously and never retried.
 */
public class ConfigurationException extends RestCoreException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
