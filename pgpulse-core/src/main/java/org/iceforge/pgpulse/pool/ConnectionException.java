package org.iceforge.pgpulse.pool;

/**
 * A connection could not be provided: the physical open failed after its retry budget, the
 * acquisition timed out, or the pool is closed.
 */
public class ConnectionException extends RuntimeException {
    public ConnectionException(String message, Throwable cause) { super(message, cause); }
    public ConnectionException(String message) { super(message); }
}
