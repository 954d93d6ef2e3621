package org.iceforge.pgpulse.query;

/** A request was rejected before any connection was touched. */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
