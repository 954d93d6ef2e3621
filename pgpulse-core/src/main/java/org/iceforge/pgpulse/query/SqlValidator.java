package org.iceforge.pgpulse.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Side-effect-free checks run before a statement is sent. Destructive shapes are reported as
 * warnings so the caller can ask for confirmation.
 */
public final class SqlValidator {

    static final String EMPTY = "SQL query cannot be empty";
    static final String DESTRUCTIVE = "Potentially dangerous operation detected. Please be careful with destructive queries.";
    static final String UNGUARDED_DELETE = "DELETE without a WHERE clause removes every row in the table.";

    private static final List<Pattern> DESTRUCTIVE_PATTERNS = List.of(
            Pattern.compile("\\bdrop\\s+database\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdrop\\s+schema\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdrop\\s+table\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\btruncate\\s+table\\b", Pattern.CASE_INSENSITIVE));

    private static final Pattern DELETE_FROM = Pattern.compile("\\bdelete\\s+from\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE = Pattern.compile("\\bwhere\\b", Pattern.CASE_INSENSITIVE);

    private SqlValidator() {}

    public static SqlValidation validate(String sql) {
        String trimmed = sql == null ? "" : sql.trim();
        if (trimmed.isEmpty()) {
            return new SqlValidation(false, List.of(EMPTY), List.of());
        }

        List<String> warnings = new ArrayList<>();
        for (Pattern p : DESTRUCTIVE_PATTERNS) {
            if (p.matcher(trimmed).find()) {
                warnings.add(DESTRUCTIVE);
                break;
            }
        }
        for (String statement : trimmed.split(";")) {
            if (DELETE_FROM.matcher(statement).find() && !WHERE.matcher(statement).find()) {
                warnings.add(UNGUARDED_DELETE);
                break;
            }
        }
        return new SqlValidation(true, List.of(), warnings);
    }

    /** Throws {@link ValidationException} for the first error. */
    static void require(String sql) {
        SqlValidation v = validate(sql);
        if (!v.isValid()) {
            throw new ValidationException(v.errors().get(0));
        }
    }
}
