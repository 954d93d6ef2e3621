package org.iceforge.pgpulse.query;

import java.util.regex.Pattern;

/** Cosmetic layout: one line per main clause, one select item per line. */
public final class SqlFormatter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");
    private static final Pattern SELECT = Pattern.compile("\\bselect\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLAUSE = Pattern.compile(
            "\\s*\\b(from|where|order\\s+by|group\\s+by|having|(?:(?:left|right|inner|full|cross)\\s+(?:outer\\s+)?)?join)\\b",
            Pattern.CASE_INSENSITIVE);

    private SqlFormatter() {}

    public static String format(String sql) {
        if (sql == null) {
            return "";
        }
        String s = WHITESPACE.matcher(sql).replaceAll(" ");
        s = COMMA.matcher(s).replaceAll(",\n    ");
        s = SELECT.matcher(s).replaceAll("SELECT");
        s = CLAUSE.matcher(s).replaceAll(m -> "\n" + WHITESPACE.matcher(m.group(1).toUpperCase()).replaceAll(" "));
        return s.trim();
    }
}
