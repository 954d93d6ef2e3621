package org.iceforge.pgpulse.error;

import java.util.Objects;

/** The server rejected or failed a statement. Carries the normalized {@link QueryError}. */
public class QueryException extends RuntimeException {

    private final QueryError error;

    public QueryException(QueryError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public QueryException(QueryError error) {
        this(error, null);
    }

    public QueryError error() {
        return error;
    }
}
