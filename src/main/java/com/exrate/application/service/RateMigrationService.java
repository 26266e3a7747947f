package com.exrate.application.service;

import com.exrate.application.port.in.RateMigrationUseCase;
import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.application.port.out.ExpenseRepository;
import com.exrate.application.port.out.HistoricalRateRepository;
import com.exrate.config.ExchangeRateConfig;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.CurrencyPair;
import com.exrate.domain.model.Expense;
import com.exrate.domain.model.HistoricalRate;
import com.exrate.domain.model.MigrationResult;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backfills historical rates for expenses recorded before rates were frozen at creation time.
 * <p>
 * Expenses are read in keyset pages and processed one at a time. Per expense, rates come from
 * (1) the inline conversion rate, (2) the closest rate in the rate history within the window,
 * (3) the live provider. Existing rows are never overwritten.
 */
@Slf4j
public class RateMigrationService implements RateMigrationUseCase {

    private final ExpenseRepository expenseRepository;
    private final HistoricalRateRepository historicalRateRepository;
    private final ExchangeRateHistoryRepository historyRepository;
    private final LiveRateResolver liveRateResolver;
    private final ExchangeRateConfig config;
    private final Clock clock;

    public RateMigrationService(
            ExpenseRepository expenseRepository,
            HistoricalRateRepository historicalRateRepository,
            ExchangeRateHistoryRepository historyRepository,
            LiveRateResolver liveRateResolver,
            ExchangeRateConfig config,
            Clock clock
    ) {
        this.expenseRepository = expenseRepository;
        this.historicalRateRepository = historicalRateRepository;
        this.historyRepository = historyRepository;
        this.liveRateResolver = liveRateResolver;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Future<MigrationResult> migrateExistingExpenses() {
        long startTime = clock.millis();
        Progress progress = new Progress();
        log.info("Starting historical rate migration (batch size: {}, window: {} days)",
                config.getMigrationBatchSize(), config.getMigrationWindowDays());

        return processPagesAfter(0L, progress)
                .recover(error -> {
                    log.error("Historical rate migration aborted: {}", error.getMessage());
                    progress.errors.add("Migration failed: " + error.getMessage());
                    return Future.succeededFuture();
                })
                .map(v -> progress.toResult(clock.millis() - startTime))
                .onSuccess(result -> log.info("Historical rate migration finished: total={}, migrated={}, skipped={}, errors={}, duration={} ms",
                        result.totalExpenses(), result.migratedExpenses(), result.skippedExpenses(),
                        result.errors().size(), result.durationMs()));
    }

    private Future<Void> processPagesAfter(long lastProcessedId, Progress progress) {
        int batchSize = config.getMigrationBatchSize();

        return expenseRepository.findAllExpensesForMigration(batchSize, lastProcessedId)
                .compose(batch -> {
                    if (batch.isEmpty()) {
                        return Future.succeededFuture();
                    }
                    log.info("Processing batch of {} expenses after id {}", batch.size(), lastProcessedId);

                    Future<Void> chain = Future.succeededFuture();
                    for (Expense expense : batch) {
                        chain = chain.compose(v -> migrateExpense(expense, progress));
                    }

                    long nextId = batch.get(batch.size() - 1).getId();
                    boolean lastPage = batch.size() < batchSize || nextId <= lastProcessedId;
                    return chain.compose(v -> lastPage
                            ? Future.<Void>succeededFuture()
                            : processPagesAfter(nextId, progress));
                });
    }

    private Future<Void> migrateExpense(Expense expense, Progress progress) {
        progress.total++;
        long expenseId = expense.getId();

        Future<Void> migration;
        try {
            migration = historicalRateRepository.countHistoricalRatesForExpense(expenseId)
                    .compose(existing -> {
                        if (existing > 0) {
                            log.debug("Skipping expense {} - {} historical rate(s) already exist", expenseId, existing);
                            progress.skipped++;
                            return Future.succeededFuture();
                        }
                        return migrateExpenseRates(expense, progress)
                                .onSuccess(saved -> {
                                    progress.migrated++;
                                    log.debug("Migrated expense {} ({} rates), progress {}/{}",
                                            expenseId, saved, progress.migrated, progress.total);
                                })
                                .<Void>mapEmpty();
                    });
        } catch (RuntimeException e) {
            migration = Future.failedFuture(e);
        }

        return migration.recover(error -> {
            String reason = error instanceof ExchangeRateException
                    ? ((ExchangeRateException) error).getReason()
                    : error.getMessage();
            String message = "Expense " + expenseId + ": " + reason;
            log.error("Migration failed for expense {}: {}", expenseId, error.getMessage());
            progress.errors.add(message);
            progress.skipped++;
            return Future.succeededFuture();
        });
    }

    /**
     * Resolve and persist every pair for one expense
     * @return Future with the number of rows written
     */
    private Future<Integer> migrateExpenseRates(Expense expense, Progress progress) {
        String baseCurrency = config.getBaseCurrency();
        LocalDateTime recordedAt = expense.getDate() != null ? expense.getDate() : LocalDateTime.now(clock);
        Map<CurrencyPair, Double> resolved = new LinkedHashMap<>();

        if (expense.hasInlineConversionRate() && !baseCurrency.equals(expense.getCurrency())) {
            double rate = expense.getConversionRate();
            log.debug("Using inline conversion rate {} for expense {}", rate, expense.getId());
            resolved.put(CurrencyPair.of(expense.getCurrency(), baseCurrency), rate);
            resolved.put(CurrencyPair.of(baseCurrency, expense.getCurrency()), 1.0 / rate);
        }

        Future<Void> chain = Future.succeededFuture();
        for (CurrencyPair pair : supportedPairs()) {
            if (resolved.containsKey(pair)) {
                continue;
            }
            chain = chain.compose(v -> resolvePair(expense, pair, recordedAt.toLocalDate(), progress)
                    .onSuccess(rate -> rate.ifPresent(r -> resolved.put(pair, r)))
                    .<Void>mapEmpty());
        }

        return chain.compose(v -> {
            if (resolved.isEmpty()) {
                return Future.failedFuture(new ExchangeRateException(ExchangeRateError.RATE_NOT_FOUND,
                        "No rates available for migration"));
            }
            List<HistoricalRate> rows = new ArrayList<>(resolved.size());
            resolved.forEach((pair, rate) -> rows.add(new HistoricalRate(
                    expense.getId(), pair.fromCurrency(), pair.toCurrency(), rate, recordedAt)));
            return historicalRateRepository.createHistoricalRates(rows)
                    .recover(error -> Future.failedFuture(ExchangeRateException.databaseError("Saving historical rates", error)))
                    .map(inserted -> rows.size());
        });
    }

    /**
     * Closest recorded rate in the window, else the live rate; empty when both fail
     */
    private Future<Optional<Double>> resolvePair(Expense expense, CurrencyPair pair, LocalDate date, Progress progress) {
        String from = pair.fromCurrency();
        String to = pair.toCurrency();

        return historyRepository.findClosestHistoricalRateInWindow(from, to, date, config.getMigrationWindowDays())
                .otherwise(error -> {
                    log.warn("Rate history lookup failed for {} on {} (expense {}): {}", pair, date, expense.getId(), error.getMessage());
                    return Optional.empty();
                })
                .compose(closest -> {
                    if (closest.isPresent() && closest.get().getRate() > 0) {
                        log.debug("Expense {} {}: closest historical rate {} ({} days away)",
                                expense.getId(), pair, closest.get().getRate(), closest.get().getDaysDifference());
                        return Future.succeededFuture(Optional.of(closest.get().getRate()));
                    }
                    return liveRateResolver.currentRate(from, to)
                            .map(Optional::of)
                            .otherwise(error -> {
                                log.warn("Failed to fetch current rate {} during migration of expense {}: {}",
                                        pair, expense.getId(), error.getMessage());
                                progress.warnings.add("Expense " + expense.getId() + " " + pair + ": " + error.getMessage());
                                return Optional.empty();
                            });
                });
    }

    private List<CurrencyPair> supportedPairs() {
        List<String> currencies = config.getSupportedCurrencies();
        List<CurrencyPair> pairs = new ArrayList<>();
        for (String from : currencies) {
            for (String to : currencies) {
                if (!from.equals(to)) {
                    pairs.add(CurrencyPair.of(from, to));
                }
            }
        }
        return pairs;
    }

    private static final class Progress {
        int total;
        int migrated;
        int skipped;
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        MigrationResult toResult(long durationMs) {
            return new MigrationResult(total, migrated, skipped,
                    Collections.unmodifiableList(new ArrayList<>(errors)),
                    Collections.unmodifiableList(new ArrayList<>(warnings)),
                    durationMs);
        }
    }
}
