package org.iceforge.pgpulse.pool;

import org.iceforge.pgpulse.jdbc.ConnectionSettings;
import org.iceforge.pgpulse.jdbc.spi.JdbcClientContext;
import org.iceforge.pgpulse.jdbc.spi.JdbcConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.Mockito.mock;

/** Hands out Mockito connections and remembers which database each one was opened for. */
class FakeConnectionProvider implements JdbcConnectionProvider {
    static final String ID = "fake";

    final AtomicInteger attempts = new AtomicInteger();
    final AtomicInteger opened = new AtomicInteger();
    final Map<Connection, String> databaseOf = Collections.synchronizedMap(new IdentityHashMap<>());
    private volatile int failuresLeft;

    void failNext(int n) {
        this.failuresLeft = n;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean supports(JdbcClientContext ctx) {
        return true;
    }

    @Override
    public Connection openConnection(JdbcClientContext ctx, ConnectionSettings settings) throws Exception {
        attempts.incrementAndGet();
        if (failuresLeft > 0) {
            failuresLeft--;
            throw new SQLException("connection refused", "08001");
        }
        Connection c = mock(Connection.class);
        databaseOf.put(c, settings.database());
        opened.incrementAndGet();
        return c;
    }
}
