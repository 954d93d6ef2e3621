package org.iceforge.pgpulse.jdbc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticConnectionConfigProviderTest {

    @Test
    void blankDatabaseResolvesToDefault() {
        StaticConnectionConfigProvider p = StaticConnectionConfigProvider.builder()
                .host("db.internal")
                .port(6432)
                .credentials("app", "secret")
                .defaultDatabase("shop")
                .build();

        ConnectionSettings s = p.resolve(" ");

        assertThat(s.database()).isEqualTo("shop");
        assertThat(s.effectiveJdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:6432/shop");
        assertThat(s.username()).isEqualTo("app");
        assertThat(s.describe()).doesNotContain("secret");
    }

    @Test
    void unknownDatabaseFallsBackToFirstKnown() {
        StaticConnectionConfigProvider p = StaticConnectionConfigProvider.builder()
                .knownDatabases(List.of("analytics", "shop"))
                .build();

        assertThat(p.defaultDatabase()).isEqualTo("analytics");
        assertThat(p.resolve("shop").database()).isEqualTo("shop");
        assertThat(p.resolve("other").database()).isEqualTo("analytics");
    }

    @Test
    void urlTemplateReceivesDatabaseName() {
        StaticConnectionConfigProvider p = StaticConnectionConfigProvider.builder()
                .jdbcUrlTemplate("jdbc:postgresql://pg:5432/{database}?sslmode=require")
                .defaultDatabase("shop")
                .property("connectTimeout", "5")
                .build();

        ConnectionSettings s = p.resolve("orders");

        assertThat(s.effectiveJdbcUrl()).isEqualTo("jdbc:postgresql://pg:5432/orders?sslmode=require");
        assertThat(s.properties()).containsEntry("connectTimeout", "5");
    }

    @Test
    void defaultDatabaseIsRequired() {
        assertThatThrownBy(() -> StaticConnectionConfigProvider.builder().build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
