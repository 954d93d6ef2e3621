package org.iceforge.pgpulse.error;

import java.util.regex.Pattern;

/**
 * Turns a {@link RawDriverError} into a {@link QueryError}.
 * <p>
 * PostgreSQL's {@code L} field is a line in the server's own source, not in the statement. When a
 * reported line is far beyond the statement's line count (more than ten times), the line is
 * recomputed from the character position, or set to 1 for a plain syntax error whose position
 * lies outside the text. Otherwise the reported coordinates are kept.
 */
public final class ErrorNormalizer {

    static final String UNKNOWN_ERROR = "Unknown database error";

    private static final int LINE_MISMATCH_FACTOR = 10;
    private static final Pattern SYNTAX_ERROR = Pattern.compile("(?i)syntax error|at or near");

    private ErrorNormalizer() {}

    public static QueryError normalize(RawDriverError raw, String exactSqlSent) {
        String sql = exactSqlSent == null ? "" : exactSqlSent;
        String message = raw.message() == null || raw.message().isBlank() ? UNKNOWN_ERROR : raw.message();
        Integer line = raw.line();
        Integer position = raw.position();

        if (line != null && position != null) {
            int actualLineCount = lineCount(sql);
            if (line > actualLineCount * LINE_MISMATCH_FACTOR) {
                if (position <= sql.length()) {
                    line = lineCount(sql.substring(0, position));
                } else if (SYNTAX_ERROR.matcher(message).find()) {
                    line = 1;
                }
            }
        }
        return new QueryError(message, line, position, raw.detail(), raw.where(), raw.code());
    }

    public static QueryError normalize(Throwable error, String exactSqlSent) {
        return normalize(RawDriverError.from(error), exactSqlSent);
    }

    /** Number of segments produced by splitting on '\n', trailing empty segments included. */
    static int lineCount(String text) {
        int n = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                n++;
            }
        }
        return n;
    }
}
