package com.exrate.application.service;

import com.exrate.application.port.in.HistoricalRateUseCase;
import com.exrate.application.port.out.ExpenseRepository;
import com.exrate.application.port.out.HistoricalRateRepository;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.Expense;
import com.exrate.domain.model.HistoricalRate;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only record of the rate in force when each expense was recorded.
 * Rows are created once and never updated; a missing row means "use the current rate".
 */
@Slf4j
public class HistoricalRateStore implements HistoricalRateUseCase {

    private final HistoricalRateRepository historicalRateRepository;
    private final ExpenseRepository expenseRepository;
    private final LiveRateResolver liveRateResolver;
    private final String baseCurrency;
    private final Clock clock;

    public HistoricalRateStore(
            HistoricalRateRepository historicalRateRepository,
            ExpenseRepository expenseRepository,
            LiveRateResolver liveRateResolver,
            String baseCurrency,
            Clock clock
    ) {
        this.historicalRateRepository = historicalRateRepository;
        this.expenseRepository = expenseRepository;
        this.liveRateResolver = liveRateResolver;
        this.baseCurrency = baseCurrency;
        this.clock = clock;
    }

    /**
     * Frozen rate of an expense for a pair
     * @return Future with the rate, empty when none was recorded; failed with DATABASE_ERROR on lookup failure
     */
    public Future<Optional<Double>> get(long expenseId, String fromCurrency, String toCurrency) {
        if (fromCurrency.equals(toCurrency)) {
            return Future.succeededFuture(Optional.of(1.0));
        }

        return historicalRateRepository.findHistoricalRate(expenseId, fromCurrency, toCurrency)
                .map(found -> found.map(HistoricalRate::getRate).filter(rate -> rate > 0))
                .onSuccess(rate -> {
                    if (rate.isPresent()) {
                        log.debug("Historical rate for expense {} {}->{}: {}", expenseId, fromCurrency, toCurrency, rate.get());
                    } else {
                        log.debug("No historical rate for expense {} {}->{}", expenseId, fromCurrency, toCurrency);
                    }
                })
                .recover(error -> Future.failedFuture(ExchangeRateException.databaseError("Historical rate lookup", error)));
    }

    /**
     * Snapshot the expense currency -> base rate for an expense.
     * <p>
     * Runs detached from the expense write that triggered it: the returned future always succeeds,
     * and every failure is logged here rather than propagated.
     */
    @Override
    public Future<Void> saveRatesForExpense(long expenseId, LocalDateTime expenseDate) {
        long startTime = clock.millis();
        log.debug("Saving historical rates for expense {} (date: {})", expenseId, expenseDate);

        Future<Void> save;
        try {
            save = expenseRepository.findExpenseById(expenseId)
                    .compose(expense -> {
                        if (expense.isEmpty()) {
                            log.error("Expense {} not found for historical rate save", expenseId);
                            return Future.succeededFuture();
                        }
                        return saveForExpense(expense.get(), expenseDate != null ? expenseDate : expense.get().getDate());
                    });
        } catch (RuntimeException e) {
            save = Future.failedFuture(e);
        }

        return save
                .onSuccess(v -> log.debug("Historical rate save for expense {} finished in {} ms",
                        expenseId, clock.millis() - startTime))
                .recover(error -> {
                    log.error("Failed to save historical rates for expense {} after {} ms: {}",
                            expenseId, clock.millis() - startTime, error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> saveForExpense(Expense expense, LocalDateTime recordedAt) {
        String currency = expense.getCurrency();
        if (baseCurrency.equals(currency)) {
            log.debug("No rate needed for {} expense {}", baseCurrency, expense.getId());
            return Future.succeededFuture();
        }

        return historicalRateRepository.findHistoricalRate(expense.getId(), currency, baseCurrency)
                .compose(existing -> {
                    if (existing.isPresent()) {
                        log.debug("Expense {} already has a {}->{} rate, skipping", expense.getId(), currency, baseCurrency);
                        return Future.succeededFuture();
                    }
                    return fetchAndStore(expense, recordedAt);
                });
    }

    private Future<Void> fetchAndStore(Expense expense, LocalDateTime recordedAt) {
        String currency = expense.getCurrency();

        return liveRateResolver.currentRate(currency, baseCurrency)
                .compose(
                        rate -> historicalRateRepository.createHistoricalRates(List.of(
                                        new HistoricalRate(expense.getId(), currency, baseCurrency, rate, recordedAt)))
                                .onSuccess(inserted -> log.info("Saved {} historical rate(s) for expense {}: {}->{} = {}",
                                        inserted, expense.getId(), currency, baseCurrency, rate))
                                .<Void>mapEmpty(),
                        error -> {
                            log.warn("Could not fetch {}->{} rate for expense {}, no historical rate saved: {}",
                                    currency, baseCurrency, expense.getId(), error.getMessage());
                            return Future.succeededFuture();
                        });
    }
}
