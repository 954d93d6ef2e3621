package org.iceforge.pgpulse.query;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterMarkerRewriterTest {

    @Test
    void rewritesDollarNOutsideLiteralsAndComments() {
        String sql = "select $1, '$2', -- $3\n $2";

        var rr = ParameterMarkerRewriter.rewrite(sql, List.of("a", "b"));

        assertThat(rr.sql()).isEqualTo("select ?, '$2', -- $3\n ?");
        assertThat(rr.params()).containsExactly("a", "b");
    }

    @Test
    void supportsOutOfOrderAndRepeatedMarkers() {
        var rr = ParameterMarkerRewriter.rewrite("select $2, $1, $2", List.of("one", "two"));

        assertThat(rr.sql()).isEqualTo("select ?, ?, ?");
        assertThat(rr.params()).containsExactly("two", "one", "two");
    }

    @Test
    void leavesDollarQuotedBodiesAlone() {
        String sql = "select $1, $fn$ select $2 $fn$, $$ $3 $$";

        var rr = ParameterMarkerRewriter.rewrite(sql, List.of(1));

        assertThat(rr.sql()).isEqualTo("select ?, $fn$ select $2 $fn$, $$ $3 $$");
        assertThat(rr.params()).containsExactly(1);
    }

    @Test
    void jdbcStyleSqlPassesThrough() {
        List<Object> params = Arrays.asList("x", null);
        var rr = ParameterMarkerRewriter.rewrite("select * from t where a = ? and b = ?", params);

        assertThat(rr.sql()).isEqualTo("select * from t where a = ? and b = ?");
        assertThat(rr.params()).containsExactly("x", null);
    }

    @Test
    void missingValueIsRejected() {
        assertThatThrownBy(() -> ParameterMarkerRewriter.rewrite("select $1, $2", List.of("a")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("$2");
    }
}
