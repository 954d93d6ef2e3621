package org.iceforge.pgpulse.jdbc.spi;

import org.iceforge.pgpulse.jdbc.ConnectionSettings;

import java.sql.Connection;
import java.sql.DriverManager;
import java.util.Map;
import java.util.Properties;

/**
 * Default provider that uses DriverManager (PostgreSQL driver, or whatever driver the URL selects).
 * <p>
 * Sets {@code ApplicationName} so sessions opened by the pool are identifiable in
 * {@code pg_stat_activity}, unless the settings already carry one.
 */
public class DefaultDriverManagerJdbcConnectionProvider implements JdbcConnectionProvider {

    public static final String ID = "default";
    static final String APPLICATION_NAME = "pgpulse";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean supports(JdbcClientContext context) {
        // Always supports; used as a fallback if no other providers match.
        return true;
    }

    @Override
    public Connection openConnection(JdbcClientContext context, ConnectionSettings settings) throws Exception {
        String url = settings.effectiveJdbcUrl();

        Properties props = new Properties();
        Map<String, String> m = settings.properties();
        for (Map.Entry<String, String> e : m.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                props.put(e.getKey(), e.getValue());
            }
        }
        if (url.startsWith("jdbc:postgresql:")) {
            props.putIfAbsent("ApplicationName", APPLICATION_NAME);
        }

        // Username/password are OPTIONAL; some drivers take credentials from properties or the URL.
        if (settings.username() != null && !settings.username().isBlank()) {
            props.put("user", settings.username());
            if (settings.password() != null) {
                props.put("password", settings.password());
            }
        }

        if (!props.isEmpty()) {
            return DriverManager.getConnection(url, props);
        }
        return DriverManager.getConnection(url);
    }
}
