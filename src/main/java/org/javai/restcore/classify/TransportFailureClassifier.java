package org.javai.restcore.classify;

/**
 * Decides whether a transport fault is worth another attempt.
 * Implementations should be deterministic and side-effect free.
 */
@FunctionalInterface
public interface TransportFailureClassifier {

    /**
     * @param cause the original fault raised by the transport
     * @return true if the fault is transient
     */
    boolean isTransient(Throwable cause);

    static TransportFailureClassifier defaults() {
        return new DefaultTransportFailureClassifier();
    }
}
