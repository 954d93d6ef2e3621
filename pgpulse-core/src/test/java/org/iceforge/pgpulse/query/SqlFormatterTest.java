package org.iceforge.pgpulse.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlFormatterTest {

    @Test
    void breaksBeforeMainClausesAndAfterCommas() {
        String out = SqlFormatter.format("select a,b\n  from t   where x = 1 order by a");

        assertThat(out).isEqualTo("SELECT a,\n    b\nFROM t\nWHERE x = 1\nORDER BY a");
    }

    @Test
    void keepsQualifiedJoinsTogether() {
        String out = SqlFormatter.format("select * from a left join b on a.id = b.id inner join c on c.id = b.id");

        assertThat(out).isEqualTo("SELECT *\nFROM a\nLEFT JOIN b on a.id = b.id\nINNER JOIN c on c.id = b.id");
    }

    @Test
    void groupByAndHaving() {
        String out = SqlFormatter.format("SELECT k, count(*) FROM t GROUP BY k HAVING count(*) > 1");

        assertThat(out).isEqualTo("SELECT k,\n    count(*)\nFROM t\nGROUP BY k\nHAVING count(*) > 1");
    }

    @Test
    void nullIsEmpty() {
        assertThat(SqlFormatter.format(null)).isEmpty();
    }
}
