package org.iceforge.pgpulse.error;

import org.junit.jupiter.api.Test;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorNormalizerTest {

    private static final String THREE_LINES = "SELECT id, name\nFROM users\nWHERE id = 1 AND nme = 'x'";

    @Test
    void serverSourceLineIsMappedBackIntoTheStatement() {
        String sql = "a".repeat(19) + "\n" + "b".repeat(19) + "\n" + "c".repeat(20);
        assertThat(sql).hasSize(60);

        QueryError e = ErrorNormalizer.normalize(new RawDriverError("syntax error", 5000, 40, null, null, "42601"), sql);

        assertThat(e.line()).isBetween(1, 3);
        // Character 40 is the second newline, so the prefix spans all three lines.
        assertThat(e.line()).isEqualTo(3);
        assertThat(e.position()).isEqualTo(40);
    }

    @Test
    void plausibleCoordinatesAreKept() {
        QueryError e = ErrorNormalizer.normalize(new RawDriverError("boom", 3, 20, null, null, null), THREE_LINES);

        assertThat(e.line()).isEqualTo(3);
        assertThat(e.position()).isEqualTo(20);
    }

    @Test
    void syntaxErrorBeyondTextFallsBackToFirstLine() {
        QueryError e = ErrorNormalizer.normalize(
                new RawDriverError("syntax error at or near \"FORM\"", 1200, 500, null, null, "42601"), THREE_LINES);

        assertThat(e.line()).isEqualTo(1);
    }

    @Test
    void otherErrorBeyondTextKeepsReportedLine() {
        QueryError e = ErrorNormalizer.normalize(
                new RawDriverError("relation does not exist", 1200, 500, null, null, "42P01"), THREE_LINES);

        assertThat(e.line()).isEqualTo(1200);
    }

    @Test
    void missingPositionLeavesLineUntouched() {
        QueryError e = ErrorNormalizer.normalize(new RawDriverError("x", 5000, null, null, null, null), THREE_LINES);
        assertThat(e.line()).isEqualTo(5000);
        assertThat(e.position()).isNull();
    }

    @Test
    void missingMessageGetsGenericText() {
        QueryError e = ErrorNormalizer.normalize(new RawDriverError(null, null, null, null, null, null), "SELECT 1");
        assertThat(e.message()).isEqualTo("Unknown database error");
    }

    @Test
    void extractsServerFieldsFromPostgresException() {
        ServerErrorMessage sem = new ServerErrorMessage(
                "SERROR\0C42703\0Mcolumn \"nme\" does not exist\0P40\0Dsome detail\0Wsome context\0Fparse_relation.c\0L3722\0");
        PSQLException pg = new PSQLException(sem);

        QueryError e = ErrorNormalizer.normalize(new SQLException("wrapped", pg), THREE_LINES);

        assertThat(e.message()).isEqualTo("column \"nme\" does not exist");
        assertThat(e.code()).isEqualTo("42703");
        assertThat(e.detail()).isEqualTo("some detail");
        assertThat(e.where()).isEqualTo("some context");
        assertThat(e.position()).isEqualTo(40);
        assertThat(e.line()).isEqualTo(3);
    }

    @Test
    void plainSqlExceptionKeepsMessageAndState() {
        RawDriverError raw = RawDriverError.from(new SQLException("Table \"NOPE\" not found", "42S02"));

        assertThat(raw.message()).isEqualTo("Table \"NOPE\" not found");
        assertThat(raw.code()).isEqualTo("42S02");
        assertThat(raw.line()).isNull();
    }

    @Test
    void lineCountMatchesSplitOnNewline() {
        assertThat(ErrorNormalizer.lineCount("")).isEqualTo(1);
        assertThat(ErrorNormalizer.lineCount("a\nb")).isEqualTo(2);
        assertThat(ErrorNormalizer.lineCount("a\n")).isEqualTo(2);
    }
}
