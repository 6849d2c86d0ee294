package logsink.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the writable JDBC connection held by the connection guard.
 *
 * <p>The guard owns the returned connection and closes it on shutdown or when it
 * is found invalid.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
