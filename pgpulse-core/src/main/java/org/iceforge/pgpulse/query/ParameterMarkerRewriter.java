package org.iceforge.pgpulse.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites PostgreSQL {@code $n} markers to JDBC {@code ?} and lines the bind values up with
 * them. Markers inside quoted literals, quoted identifiers, comments and dollar-quoted bodies are
 * left alone. SQL with no {@code $n} markers is returned unchanged.
 */
final class ParameterMarkerRewriter {
    private ParameterMarkerRewriter() {
    }

    static Rewrite rewrite(String sql, List<Object> params) {
        if (sql == null) sql = "";
        if (params == null) params = List.of();
        if (sql.indexOf('$') < 0) {
            return new Rewrite(sql, params);
        }

        StringBuilder outSql = new StringBuilder(sql.length());
        List<Integer> refs = new ArrayList<>();

        boolean inSingle = false;
        boolean inDouble = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char n = (i + 1) < sql.length() ? sql.charAt(i + 1) : '\0';

            if (inLineComment) {
                outSql.append(c);
                if (c == '\n') inLineComment = false;
                continue;
            }
            if (inBlockComment) {
                outSql.append(c);
                if (c == '*' && n == '/') {
                    outSql.append(n);
                    i++;
                    inBlockComment = false;
                }
                continue;
            }

            if (!inSingle && !inDouble) {
                if (c == '-' && n == '-') {
                    outSql.append(c).append(n);
                    i++;
                    inLineComment = true;
                    continue;
                }
                if (c == '/' && n == '*') {
                    outSql.append(c).append(n);
                    i++;
                    inBlockComment = true;
                    continue;
                }
            }

            if (!inDouble && c == '\'') {
                if (inSingle && n == '\'') {
                    outSql.append("''");
                    i++;
                    continue;
                }
                inSingle = !inSingle;
                outSql.append(c);
                continue;
            }
            if (!inSingle && c == '"') {
                inDouble = !inDouble;
                outSql.append(c);
                continue;
            }

            if (!inSingle && !inDouble && c == '$') {
                if (Character.isDigit(n)) {
                    int j = i + 1;
                    int num = 0;
                    while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
                        num = (num * 10) + (sql.charAt(j) - '0');
                        j++;
                    }
                    if (num > 0) {
                        outSql.append('?');
                        refs.add(num);
                        i = j - 1;
                        continue;
                    }
                }
                int end = dollarQuoteEnd(sql, i);
                if (end > i) {
                    outSql.append(sql, i, end);
                    i = end - 1;
                    continue;
                }
            }

            outSql.append(c);
        }

        if (refs.isEmpty()) {
            return new Rewrite(sql, params);
        }

        List<Object> outParams = new ArrayList<>(refs.size());
        for (int ref : refs) {
            if (ref > params.size()) {
                throw new ValidationException("No value supplied for parameter $" + ref
                        + " (" + params.size() + " given)");
            }
            outParams.add(params.get(ref - 1));
        }
        return new Rewrite(outSql.toString(), outParams);
    }

    /**
     * For a {@code $tag$ ... $tag$} body starting at {@code start}, the index just past the
     * closing tag (or the end of the text if unterminated); otherwise {@code start}.
     */
    private static int dollarQuoteEnd(String sql, int start) {
        int j = start + 1;
        while (j < sql.length() && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) {
            j++;
        }
        if (j >= sql.length() || sql.charAt(j) != '$') {
            return start;
        }
        if (j > start + 1 && Character.isDigit(sql.charAt(start + 1))) {
            return start;
        }
        String tag = sql.substring(start, j + 1);
        int close = sql.indexOf(tag, j + 1);
        return close < 0 ? sql.length() : close + tag.length();
    }

    record Rewrite(String sql, List<Object> params) {
    }
}
