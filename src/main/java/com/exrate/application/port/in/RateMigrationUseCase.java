package com.exrate.application.port.in;

import com.exrate.domain.model.MigrationResult;
import io.vertx.core.Future;

/**
 * Input port for backfilling historical rates of existing expenses
 */
public interface RateMigrationUseCase {

    /**
     * Populate historical rates for every expense that has none.
     * Per-expense failures are reported in the result, the future itself does not fail.
     */
    Future<MigrationResult> migrateExistingExpenses();
}
