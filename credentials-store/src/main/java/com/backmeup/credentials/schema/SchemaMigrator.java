package com.backmeup.credentials.schema;

import com.backmeup.credentials.config.CredentialsStoreConfig;
import liquibase.Contexts;
import liquibase.LabelExpression;
import liquibase.Liquibase;
import liquibase.changelog.ChangeSet;
import liquibase.changelog.RanChangeSet;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.DatabaseException;
import liquibase.exception.LiquibaseException;
import liquibase.exception.UnexpectedLiquibaseException;
import liquibase.resource.ClassLoaderResourceAccessor;
import liquibase.structure.core.Catalog;
import liquibase.structure.core.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the Liquibase changelog of the store inside the configured namespace.
 * <p>
 * Changeset ids start with the schema version they belong to ({@code 2-idx-email}). The changeset {@code <N>-tag}
 * closes version N by tagging the database {@code v<N>}, so rolling back to a version is a rollback to its tag.
 */
@Component
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String CHANGELOG = "db/changelog/credentials-store.changelog.xml";

    private static final Pattern CHANGESET_ID = Pattern.compile("(\\d+)-([\\w-]+)");

    private final JdbcTemplate jdbc;
    private final CredentialsStoreConfig config;

    public SchemaMigrator(JdbcTemplate jdbc, CredentialsStoreConfig config) {
        this.jdbc = jdbc;
        this.config = config;
    }

    /**
     * Applies every changeset not yet recorded in the namespace.
     *
     * @return the versions touched by this call, empty when the schema was already current
     */
    public List<Integer> migrate() {
        String namespace = config.getNamespace();
        List<Integer> pending;
        try {
            List<ChangeSet> unrun = withLiquibase(liquibase -> liquibase.listUnrunChangeSets(new Contexts(), new LabelExpression()));
            if (unrun.isEmpty()) {
                log.debug("Schema of {} is current", namespace);
                return List.of();
            }
            pending = unrun.stream()
                .map(ChangeSet::getId)
                .map(SchemaMigrator::versionOf)
                .filter(version -> version > 0)
                .distinct()
                .sorted()
                .toList();
            log.info("Applying migrations {} to {}", pending, namespace);
            withLiquibase(liquibase -> {
                liquibase.update(new Contexts(), new LabelExpression());
                return null;
            });
        } catch (LiquibaseException | UnexpectedLiquibaseException e) {
            throw new MigrationException(currentVersion() + 1, e);
        }
        return pending;
    }

    /**
     * Rolls back every version above the target, newest first.
     *
     * @return the versions rolled back
     */
    public List<Integer> rollbackTo(int targetVersion) {
        if (targetVersion < 0) {
            throw new IllegalArgumentException("Target version must not be negative: " + targetVersion);
        }
        List<Integer> applied = appliedVersions();
        List<Integer> rolledBack = new ArrayList<>();
        for (int i = applied.size() - 1; i >= 0 && applied.get(i) > targetVersion; i--) {
            rolledBack.add(applied.get(i));
        }
        if (rolledBack.isEmpty()) {
            return rolledBack;
        }

        log.info("Rolling back migrations {} in {}", rolledBack, config.getNamespace());
        try {
            withLiquibase(liquibase -> {
                liquibase.rollback(tag(targetVersion), new Contexts(), new LabelExpression());
                return null;
            });
        } catch (LiquibaseException | UnexpectedLiquibaseException e) {
            throw new MigrationException(currentVersion(), e);
        }
        return rolledBack;
    }

    public int currentVersion() {
        List<Integer> applied = appliedVersions();
        return applied.isEmpty() ? 0 : applied.get(applied.size() - 1);
    }

    public int latestVersion() {
        try {
            return withLiquibase(liquibase -> liquibase.getDatabaseChangeLog().getChangeSets().stream()
                .mapToInt(changeSet -> versionOf(changeSet.getId()))
                .max()
                .orElse(0));
        } catch (LiquibaseException e) {
            throw new IllegalStateException("Cannot read changelog " + CHANGELOG, e);
        }
    }

    /** Versions whose closing tag changeset ran, ascending. */
    private List<Integer> appliedVersions() {
        try {
            return withLiquibase(liquibase -> liquibase.getDatabase().getRanChangeSetList().stream()
                .map(RanChangeSet::getId)
                .filter(SchemaMigrator::closesVersion)
                .map(SchemaMigrator::versionOf)
                .filter(version -> version > 0)
                .sorted()
                .toList());
        } catch (LiquibaseException e) {
            throw new DataAccessResourceFailureException(
                "Cannot read the changelog history of " + config.getNamespace(), e);
        }
    }

    static int versionOf(String changeSetId) {
        Matcher matcher = CHANGESET_ID.matcher(changeSetId);
        if (!matcher.matches()) {
            throw new IllegalStateException("Changeset id must start with its schema version: " + changeSetId);
        }
        return Integer.parseInt(matcher.group(1));
    }

    static boolean closesVersion(String changeSetId) {
        Matcher matcher = CHANGESET_ID.matcher(changeSetId);
        return matcher.matches() && matcher.group(2).equals("tag");
    }

    static String tag(int version) {
        return "v" + version;
    }

    // ConnectionCallback only lets SQLException through, so Liquibase failures cross it wrapped
    private <T> T withLiquibase(LiquibaseWork<T> work) throws LiquibaseException {
        try {
            return jdbc.execute((ConnectionCallback<T>) con -> {
                try {
                    return work.run(open(con));
                } catch (LiquibaseException e) {
                    throw new LiquibaseFailure(e);
                }
            });
        } catch (LiquibaseFailure e) {
            throw e.getCause();
        }
    }

    private Liquibase open(Connection con) throws DatabaseException {
        Database database = DatabaseFactory.getInstance().findCorrectDatabaseImplementation(new JdbcConnection(con));
        // MySQL databases are JDBC catalogs, H2 has schemas
        if (database.supportsSchemas()) {
            String schema = database.correctObjectName(config.getNamespace(), Schema.class);
            database.setDefaultSchemaName(schema);
            database.setLiquibaseSchemaName(schema);
        } else {
            String catalog = database.correctObjectName(config.getNamespace(), Catalog.class);
            database.setDefaultCatalogName(catalog);
            database.setLiquibaseCatalogName(catalog);
        }
        return new Liquibase(CHANGELOG, new ClassLoaderResourceAccessor(), database);
    }

    @FunctionalInterface
    private interface LiquibaseWork<T> {
        T run(Liquibase liquibase) throws LiquibaseException;
    }

    private static class LiquibaseFailure extends RuntimeException {
        LiquibaseFailure(LiquibaseException cause) {
            super(cause);
        }

        @Override
        public synchronized LiquibaseException getCause() {
            return (LiquibaseException) super.getCause();
        }
    }

    public static class MigrationException extends RuntimeException {
        private final int version;

        public MigrationException(int version, Throwable cause) {
            super("Migration V" + version + " failed: " + cause.getMessage(), cause);
            this.version = version;
        }

        public int getVersion() {
            return version;
        }
    }
}
