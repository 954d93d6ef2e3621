package org.iceforge.pgpulse.jdbc.spi;

import org.iceforge.pgpulse.jdbc.ConnectionSettings;

import java.util.Map;
import java.util.Set;

/**
 * What a provider may inspect when deciding whether it handles a connection.
 * Carries only property names, never values or credentials.
 */
public record JdbcClientContext(
        String host,
        int port,
        String database,
        Map<String, String> tags,
        Set<String> propertyNames
) {
    public JdbcClientContext {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        propertyNames = propertyNames == null ? Set.of() : Set.copyOf(propertyNames);
    }

    static JdbcClientContext of(ConnectionSettings settings) {
        return new JdbcClientContext(settings.host(), settings.port(), settings.database(),
                settings.tags(), settings.properties().keySet());
    }

    public boolean hasTag(String key, String value) {
        return value != null && value.equals(tags.get(key));
    }
}
