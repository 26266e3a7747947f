package com.exrate.domain.model;

import java.util.List;

/**
 * Summary of a historical rate backfill run
 * Skipped covers both "already migrated" and "failed"; failures have a matching entry in errors.
 * Warnings hold per-pair failures that did not prevent the expense from being migrated.
 */
public record MigrationResult(
        int totalExpenses,
        int migratedExpenses,
        int skippedExpenses,
        List<String> errors,
        List<String> warnings,
        long durationMs
) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
