package org.pgninja.connection;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Where and how to open the single session.
 * <p>
 * Username/password are optional; some JDBC drivers take credentials from {@code properties} instead.
 */
public record ConnectionSettings(
        String jdbcUrl,
        String username,
        String password,
        Map<String, String> properties
) {
    public ConnectionSettings {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static ConnectionSettings of(String jdbcUrl) {
        return new ConnectionSettings(jdbcUrl, null, null, Map.of());
    }

    public static ConnectionSettings of(String jdbcUrl, String username, String password) {
        return new ConnectionSettings(jdbcUrl, username, password, Map.of());
    }

    /**
     * Driver properties for the session: the extra {@code properties} plus {@code user} and {@code password}
     * when a username is set.
     */
    public Properties driverProperties() {
        Properties props = new Properties();
        props.putAll(properties);
        if (username != null && !username.isBlank()) {
            props.setProperty("user", username);
            props.setProperty("password", password == null ? "" : password);
        }
        return props;
    }

    /** Never prints the password. */
    @Override
    public String toString() {
        return "ConnectionSettings[jdbcUrl=" + jdbcUrl + ", username=" + username
                + ", propertiesKeys=" + properties.keySet() + "]";
    }
}
