package eventflow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for work that runs outside a caller's transaction:
 * outbox claims and status updates, saga timer claims and dead-entry management.
 *
 * <p>Callers are responsible for closing the returned connection.
 */
public interface ConnectionProvider {

    /**
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
