package com.backmeup.credentials.service;

import com.backmeup.credentials.config.CredentialsStoreConfig;
import com.backmeup.credentials.model.InitializationReport;
import com.backmeup.credentials.schema.DatabaseDialect;
import com.backmeup.credentials.schema.SchemaMigrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Brings the credentials store to its expected state: namespace, users table and indexes, seed account.
 * Safe to run any number of times; every step is a no-op when its target already exists.
 */
@Service
public class CredentialsStoreInitializer {

    private static final Logger log = LoggerFactory.getLogger(CredentialsStoreInitializer.class);

    private final JdbcTemplate jdbc;
    private final CredentialsStoreConfig config;
    private final SchemaMigrator schemaMigrator;
    private final SeedDataLoader seedDataLoader;

    public CredentialsStoreInitializer(JdbcTemplate jdbc,
                                       CredentialsStoreConfig config,
                                       SchemaMigrator schemaMigrator,
                                       SeedDataLoader seedDataLoader) {
        this.jdbc = jdbc;
        this.config = config;
        this.schemaMigrator = schemaMigrator;
        this.seedDataLoader = seedDataLoader;
    }

    public InitializationReport initialize() {
        long t0 = System.nanoTime();
        String namespace = config.getNamespace();

        DatabaseDialect dialect = step("connect", () -> DatabaseDialect.detect(jdbc));

        if (config.isCreateNamespace()) {
            step("namespace", () -> {
                jdbc.execute(dialect.createNamespaceSql(namespace));
                return null;
            });
        } else {
            log.debug("Namespace creation disabled, expecting {} to exist", namespace);
        }

        List<Integer> applied = step("migration", schemaMigrator::migrate);
        int schemaVersion = step("migration", schemaMigrator::currentVersion);

        boolean seedInserted = false;
        if (config.getSeed().isEnabled()) {
            seedInserted = step("seed", () -> seedDataLoader.load(config.getSeed().toSeedAccount()));
        } else {
            log.debug("Seed account disabled");
        }

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.info("Initialized {} on {} (applied={}, schemaVersion={}, seedInserted={}) in {}ms",
            namespace, dialect, applied, schemaVersion, seedInserted, tookMs);
        return new InitializationReport(namespace, dialect.name(), applied, schemaVersion, seedInserted);
    }

    private <T> T step(String name, Step<T> step) {
        try {
            return step.run();
        } catch (SchemaMigrator.MigrationException e) {
            log.error("Initialization of {} aborted at migration V{}", config.getNamespace(), e.getVersion(), e);
            throw new StoreInitializationException("migration V" + e.getVersion(), e);
        } catch (DataAccessException | DatabaseDialect.UnsupportedDatabaseException e) {
            log.error("Initialization of {} aborted at step '{}'", config.getNamespace(), name, e);
            throw new StoreInitializationException(name, e);
        } catch (SeedDataLoader.SeedConflictException e) {
            // already names both accounts, callers catch it by type
            log.error("Initialization of {} aborted at step '{}': {}", config.getNamespace(), name, e.getMessage());
            throw e;
        }
    }

    @FunctionalInterface
    private interface Step<T> {
        T run();
    }

    public static class StoreInitializationException extends RuntimeException {
        private final String step;

        public StoreInitializationException(String step, Throwable cause) {
            super("Credentials store initialization failed at " + step + ": " + cause.getMessage(), cause);
            this.step = step;
        }

        public String getStep() {
            return step;
        }
    }
}
