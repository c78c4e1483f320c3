package com.backmeup.credentials.model;

import java.util.List;

/**
 * Outcome of one initialization run.
 */
public record InitializationReport(
    String namespace,
    String dialect,
    List<Integer> appliedMigrations,
    int schemaVersion,
    boolean seedInserted
) {
    public InitializationReport {
        appliedMigrations = appliedMigrations == null ? List.of() : List.copyOf(appliedMigrations);
    }

    /** False when the run found everything already in place. */
    public boolean changed() {
        return !appliedMigrations.isEmpty() || seedInserted;
    }
}
