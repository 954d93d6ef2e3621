package org.iceforge.pgpulse.error;

import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

/**
 * Error fields as reported by the driver, before any coordinate correction.
 * Absent numeric fields are {@code null}.
 */
public record RawDriverError(
        String message,
        Integer line,
        Integer position,
        String detail,
        String where,
        String code
) {

    public static RawDriverError from(Throwable t) {
        if (t == null) {
            return new RawDriverError(null, null, null, null, null, null);
        }
        PSQLException pg = findPsqlException(t);
        if (pg != null && pg.getServerErrorMessage() != null) {
            return fromServerMessage(pg.getServerErrorMessage());
        }
        if (t instanceof SQLException sql) {
            return new RawDriverError(sql.getMessage(), null, null, null, null, sql.getSQLState());
        }
        return new RawDriverError(t.getMessage(), null, null, null, null, null);
    }

    public static RawDriverError fromServerMessage(ServerErrorMessage m) {
        return new RawDriverError(
                m.getMessage(),
                positive(m.getLine()),
                positive(m.getPosition()),
                m.getDetail(),
                m.getWhere(),
                m.getSQLState());
    }

    private static PSQLException findPsqlException(Throwable t) {
        Throwable cur = t;
        for (int depth = 0; cur != null && depth < 8; depth++) {
            if (cur instanceof PSQLException pg) {
                return pg;
            }
            cur = cur.getCause();
        }
        return null;
    }

    // ServerErrorMessage reports 0 for a missing field.
    private static Integer positive(int v) {
        return v > 0 ? v : null;
    }
}
