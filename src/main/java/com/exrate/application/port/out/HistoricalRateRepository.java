package com.exrate.application.port.out;

import com.exrate.domain.model.HistoricalRate;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Output port for per-expense historical rates
 */
public interface HistoricalRateRepository {

    Future<Optional<HistoricalRate>> findHistoricalRate(long expenseId, String fromCurrency, String toCurrency);

    Future<Integer> countHistoricalRatesForExpense(long expenseId);

    /**
     * Insert rows that do not exist yet.
     * A row whose (expenseId, fromCurrency, toCurrency) already exists is left untouched and is not an error.
     * @return Future with the number of rows actually inserted
     */
    Future<Integer> createHistoricalRates(List<HistoricalRate> rates);
}
