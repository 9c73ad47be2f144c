package mailbridge.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for work done outside a caller's transaction
 * (scheduler bursts, auto-committed enqueues, registry maintenance).
 *
 * <p>Callers are responsible for closing the returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
