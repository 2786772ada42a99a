package com.example.mediasync.metadata.jdbi;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pooled connection to the metadata database with the schema migrated on open.
 */
public final class MetadataDatabase implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataDatabase.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private MetadataDatabase(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    public static MetadataDatabase open(String jdbcUrl) {
        ensureParentDirectory(jdbcUrl);
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("media-sync-db");
        config.setConnectionTestQuery("SELECT 1");
        if (jdbcUrl.startsWith(SQLITE_PREFIX)) {
            config.setMaximumPoolSize(4);
            config.addDataSourceProperty("journal_mode", "WAL");
            config.addDataSourceProperty("synchronous", "NORMAL");
            config.setConnectionInitSql("PRAGMA busy_timeout=10000");
        }
        HikariDataSource dataSource = new HikariDataSource(config);
        try {
            migrate(dataSource);
        } catch (RuntimeException ex) {
            dataSource.close();
            throw ex;
        }
        LOGGER.info("Metadata database ready at {}", jdbcUrl);
        return new MetadataDatabase(dataSource);
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    @Override
    public void close() {
        dataSource.close();
    }

    private static void migrate(HikariDataSource dataSource) {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException ex) {
                LOGGER.warn("Flyway validation failed; attempting repair.", ex);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Flyway migration failed", ex);
            throw new IllegalStateException("Flyway migration failed", ex);
        }
    }

    private static void ensureParentDirectory(String jdbcUrl) {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String location = jdbcUrl.substring(SQLITE_PREFIX.length());
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(location).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create database directory " + parent, ex);
        }
    }
}
