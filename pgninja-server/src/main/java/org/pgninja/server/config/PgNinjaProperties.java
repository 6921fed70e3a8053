package org.pgninja.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Settings of the single database session served over HTTP.
 * <p>
 * Storing the password in YAML is fine for local dev; deployments should pass it through the environment
 * ({@code PGNINJA_DATASOURCE_PASSWORD}).
 */
@ConfigurationProperties(prefix = "pgninja")
public class PgNinjaProperties {

    private Datasource datasource = new Datasource();
    private Log log = new Log();
    private Export export = new Export();

    public Datasource getDatasource() {
        return datasource;
    }

    public void setDatasource(Datasource datasource) {
        this.datasource = datasource;
    }

    public Log getLog() {
        return log;
    }

    public void setLog(Log log) {
        this.log = log;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public static class Datasource {

        /** JDBC URL, e.g. jdbc:postgresql://localhost:5432/app. */
        private String jdbcUrl;

        private String username;

        private String password;

        /** Extra driver properties (sslmode, ApplicationName, ...). */
        private Map<String, String> properties = new HashMap<>();

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Map<String, String> getProperties() {
            return properties;
        }

        public void setProperties(Map<String, String> properties) {
            this.properties = properties;
        }
    }

    public static class Log {

        /** Emit one line per query, transaction and batch. */
        private boolean enabled = true;

        /** Wrap query log lines in ANSI colour codes. */
        private boolean colors = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isColors() {
            return colors;
        }

        public void setColors(boolean colors) {
            this.colors = colors;
        }
    }

    public static class Export {

        /** Where SELECT results are written as .xlsx files. */
        private String directory = System.getProperty("java.io.tmpdir") + "/pgninja-export";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }
}
