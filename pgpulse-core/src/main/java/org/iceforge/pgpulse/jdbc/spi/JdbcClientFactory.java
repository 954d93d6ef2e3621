package org.iceforge.pgpulse.jdbc.spi;

import org.iceforge.pgpulse.jdbc.ConnectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Resolves connection settings to a {@link JdbcConnectionProvider} and opens physical connections.
 * <p>
 * Providers can be supplied explicitly (e.g. as Spring beans) or discovered via
 * {@link ServiceLoader}. Explicit providers win if provider IDs collide.
 */
public final class JdbcClientFactory {
    private static final Logger log = LoggerFactory.getLogger(JdbcClientFactory.class);

    private final List<JdbcConnectionProvider> providers;

    public JdbcClientFactory(Collection<JdbcConnectionProvider> explicitProviders) {
        List<JdbcConnectionProvider> explicit = explicitProviders == null ? List.of() : List.copyOf(explicitProviders);
        List<JdbcConnectionProvider> fromServiceLoader = ServiceLoader.load(JdbcConnectionProvider.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        Map<String, JdbcConnectionProvider> merged = new LinkedHashMap<>();
        for (JdbcConnectionProvider p : fromServiceLoader) merged.put(p.id(), p);
        for (JdbcConnectionProvider p : explicit) merged.put(p.id(), p);

        if (merged.isEmpty()) {
            JdbcConnectionProvider fallback = new DefaultDriverManagerJdbcConnectionProvider();
            merged.put(fallback.id(), fallback);
        }
        this.providers = List.copyOf(merged.values());

        log.info("Discovered JdbcConnectionProviders: {}", this.providers.stream()
                .map(JdbcConnectionProvider::id).collect(Collectors.toList()));
    }

    /** Factory with only the DriverManager provider (plus anything on the ServiceLoader path). */
    public static JdbcClientFactory withDefaults() {
        return new JdbcClientFactory(List.of(new DefaultDriverManagerJdbcConnectionProvider()));
    }

    /**
     * Open a new physical connection.
     * <p>
     * {@link ConnectionSettings#provider()} forces a provider by id; otherwise the first provider (by id)
     * whose {@link JdbcConnectionProvider#supports} accepts the context is used.
     */
    public Connection openConnection(ConnectionSettings settings) throws Exception {
        Objects.requireNonNull(settings, "settings");

        JdbcClientContext ctx = JdbcClientContext.of(settings);
        JdbcConnectionProvider provider = resolveProvider(settings.provider(), ctx);

        log.debug("Using JDBC provider id='{}' for {}", provider.id(), settings.describe());
        Connection conn = provider.openConnection(ctx, settings);
        if (conn == null) {
            throw new IllegalStateException("Provider '" + provider.id() + "' returned no connection for database=" + settings.database());
        }
        return conn;
    }

    private JdbcConnectionProvider resolveProvider(String forcedProviderId, JdbcClientContext ctx) {
        if (forcedProviderId != null && !forcedProviderId.isBlank()) {
            return providers.stream()
                    .filter(p -> forcedProviderId.equals(p.id()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "Forced JDBC provider '" + forcedProviderId + "' not found. Available: " + ids()));
        }

        // Deterministic tie-break: lexicographically by id.
        return providers.stream()
                .filter(p -> p.supports(ctx))
                .min(Comparator.comparing(JdbcConnectionProvider::id))
                .orElseThrow(() -> new IllegalStateException(
                        "No JdbcConnectionProvider supports ctx=" + safeCtx(ctx) + " providers=" + ids()));
    }

    List<String> ids() {
        return providers.stream().map(JdbcConnectionProvider::id).sorted().toList();
    }

    private static String safeCtx(JdbcClientContext ctx) {
        return "host=" + ctx.host() + ":" + ctx.port()
                + ", database=" + ctx.database()
                + ", tags=" + ctx.tags()
                + ", propertyNames=" + ctx.propertyNames();
    }
}
