package org.javai.restcore.classify;

import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.security.cert.CertificateException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;

/**
 * Treats dropped connections, failed lookups, broken TLS sessions, truncated bodies and read
 * timeouts as transient.
 *
 * <ul>
 *   <li>{@link SocketException}, including {@code ConnectException} and "connection reset"</li>
 *   <li>{@link UnknownHostException}, a name lookup that failed</li>
 *   <li>{@link SSLException}, unless the peer's certificate was rejected</li>
 *   <li>{@link EOFException}, a body cut short before its announced end</li>
 *   <li>{@link SocketTimeoutException} and {@link HttpTimeoutException}</li>
 * </ul>
 *
 * <p>The cause chain is searched, since clients often wrap the socket-level fault. A
 * {@link CertificateException} or {@link SSLPeerUnverifiedException} anywhere in the chain
 * makes the fault terminal.
 */
public class DefaultTransportFailureClassifier implements TransportFailureClassifier {

    @Override
    public boolean isTransient(Throwable cause) {
        boolean transientFault = false;
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = cause; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof CertificateException || t instanceof SSLPeerUnverifiedException) {
                return false;
            }
            if (t instanceof SocketException
                    || t instanceof UnknownHostException
                    || t instanceof SSLException
                    || t instanceof EOFException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException) {
                transientFault = true;
            }
        }
        return transientFault;
    }
}
