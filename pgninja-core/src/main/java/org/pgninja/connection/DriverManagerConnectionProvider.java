package org.pgninja.connection;

import java.sql.Connection;
import java.sql.DriverManager;

/**
 * Opens the session through {@link DriverManager}; the driver is picked from the URL.
 */
public class DriverManagerConnectionProvider implements JdbcConnectionProvider {

    @Override
    public Connection openConnection(ConnectionSettings settings) throws Exception {
        if (settings.jdbcUrl().isBlank()) {
            throw new IllegalArgumentException("jdbcUrl is required");
        }
        return DriverManager.getConnection(settings.jdbcUrl(), settings.driverProperties());
    }
}
