package com.exrate.application.port.in;

import io.vertx.core.Future;

import java.time.LocalDateTime;

/**
 * Input port for freezing the rate of an expense at creation time
 */
public interface HistoricalRateUseCase {

    /**
     * Snapshot the expense currency -> base currency rate.
     * Best effort: the returned future always succeeds, failures are only logged.
     */
    Future<Void> saveRatesForExpense(long expenseId, LocalDateTime expenseDate);
}
