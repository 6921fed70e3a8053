package org.pgninja.connection;

import java.sql.Connection;

/**
 * Pluggable way of opening the JDBC connection behind a {@link JdbcConnectionHandle}.
 * <p>
 * Deployments needing custom authentication flows (Kerberos, OAuth, cloud IAM tokens) implement this
 * instead of relying on {@link DriverManagerConnectionProvider}.
 */
@FunctionalInterface
public interface JdbcConnectionProvider {

    Connection openConnection(ConnectionSettings settings) throws Exception;
}
