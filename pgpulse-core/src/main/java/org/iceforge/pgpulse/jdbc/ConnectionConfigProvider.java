package org.iceforge.pgpulse.jdbc;

/**
 * Source of physical connection parameters.
 * <p>
 * Consulted on every acquisition so hosts or credentials rotated by the embedding application are
 * picked up for newly opened connections. Implementations decide which database a request without
 * an explicit target maps to.
 */
public interface ConnectionConfigProvider {

    /** The database used when a caller does not name one. */
    String defaultDatabase();

    /**
     * Resolve connection settings for a target database.
     *
     * @param database requested database, or {@code null}/blank for {@link #defaultDatabase()}
     */
    ConnectionSettings resolve(String database);
}
