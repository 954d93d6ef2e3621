package org.iceforge.pgpulse.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured description of a statement the server rejected.
 * <p>
 * {@code line} and {@code position} are 1-based and refer to the SQL text that was actually sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryError(
        String message,
        Integer line,
        Integer position,
        String detail,
        String where,
        String code
) {
    public QueryError {
        if (message == null || message.isBlank()) {
            message = ErrorNormalizer.UNKNOWN_ERROR;
        }
    }

    public QueryError withLine(Integer newLine) {
        return new QueryError(message, newLine, position, detail, where, code);
    }
}
