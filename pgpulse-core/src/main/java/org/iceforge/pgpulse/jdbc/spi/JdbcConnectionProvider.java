package org.iceforge.pgpulse.jdbc.spi;

import org.iceforge.pgpulse.jdbc.ConnectionSettings;

import java.sql.Connection;

/**
 * Pluggable opener for physical server connections.
 * <p>
 * Deployments that reach the server through an IAM token exchange, a local proxy, or a vendor
 * driver can implement this SPI without the pool needing to know the details.
 */
public interface JdbcConnectionProvider {

    /** A stable provider ID (e.g. "default", "iam-token", "proxy"). */
    String id();

    /** Return true if this provider should handle the given context. */
    boolean supports(JdbcClientContext context);

    /** Open a new physical connection for the resolved settings. */
    Connection openConnection(JdbcClientContext context, ConnectionSettings settings) throws Exception;
}
