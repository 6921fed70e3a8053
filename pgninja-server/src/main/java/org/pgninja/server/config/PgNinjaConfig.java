package org.pgninja.server.config;

import org.pgninja.Futures;
import org.pgninja.PgNinja;
import org.pgninja.connection.ConnectionException;
import org.pgninja.connection.ConnectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.CompletionException;

@Configuration
public class PgNinjaConfig {
    private static final Logger log = LoggerFactory.getLogger(PgNinjaConfig.class);

    /**
     * Connects eagerly; a database that cannot be reached fails application startup.
     */
    @Bean(destroyMethod = "end")
    public PgNinja pgNinja(PgNinjaProperties props) {
        PgNinjaProperties.Datasource ds = props.getDatasource();
        if (ds.getJdbcUrl() == null || ds.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("pgninja.datasource.jdbc-url is required");
        }
        ConnectionSettings settings = new ConnectionSettings(
                ds.getJdbcUrl(), ds.getUsername(), ds.getPassword(), ds.getProperties());

        PgNinja db = PgNinja.builder()
                .settings(settings)
                .log(props.getLog().isEnabled())
                .logColors(props.getLog().isColors())
                .exportDirectory(Path.of(props.getExport().getDirectory()))
                .build();
        try {
            db.connect().join();
        } catch (CompletionException e) {
            db.end();
            Throwable cause = Futures.unwrap(e);
            throw cause instanceof ConnectionException ce ? ce : new ConnectionException(cause.getMessage(), cause);
        }
        log.info("Connected to {}", settings.jdbcUrl());
        return db;
    }
}
