package com.exrate.application.service;

import com.exrate.application.port.in.ExchangeRateRefreshUseCase;
import com.exrate.application.port.in.RateFreshnessUseCase;
import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.CurrencyPair;
import com.exrate.domain.model.FreshnessResult;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Makes sure today's rates have been loaded before a write that depends on current pricing.
 * <p>
 * The refresh is raced against a timer. Whichever settles first decides the outcome; a refresh
 * that completes after the deadline is dropped without being applied.
 */
@Slf4j
public class RateFreshnessGuard implements RateFreshnessUseCase {

    private final Vertx vertx;
    private final ExchangeRateHistoryRepository historyRepository;
    private final ExchangeRateRefreshUseCase refreshUseCase;
    private final Clock clock;

    public RateFreshnessGuard(
            Vertx vertx,
            ExchangeRateHistoryRepository historyRepository,
            ExchangeRateRefreshUseCase refreshUseCase,
            Clock clock
    ) {
        this.vertx = vertx;
        this.historyRepository = historyRepository;
        this.refreshUseCase = refreshUseCase;
        this.clock = clock;
    }

    @Override
    public Future<FreshnessResult> ensureFreshRates(long timeoutMs) {
        LocalDate today = LocalDate.now(clock);

        return historyRepository.findLastUpdateDate()
                .map(lastUpdate -> lastUpdate.map(date -> !date.isBefore(today)).orElse(false))
                .otherwise(error -> {
                    // an unreadable timestamp must not block the write
                    log.warn("Could not read last rate update, skipping refresh: {}", error.getMessage());
                    return true;
                })
                .compose(fresh -> {
                    if (fresh) {
                        log.debug("Exchange rates are fresh, no update needed");
                        return Future.succeededFuture(FreshnessResult.alreadyFresh());
                    }
                    log.info("Exchange rates are stale, refreshing within {} ms", timeoutMs);
                    return refreshWithin(timeoutMs);
                });
    }

    private Future<FreshnessResult> refreshWithin(long timeoutMs) {
        Promise<FreshnessResult> promise = Promise.promise();
        AtomicBoolean settled = new AtomicBoolean(false);

        long timerId = vertx.setTimer(Math.max(1, timeoutMs), id -> {
            if (settled.compareAndSet(false, true)) {
                log.warn("Exchange rate refresh timed out after {} ms, proceeding with current rates", timeoutMs);
                promise.complete(FreshnessResult.deadlineExceeded());
            }
        });

        Future<Map<CurrencyPair, Double>> fetch;
        try {
            fetch = refreshUseCase.fetchLatestRates();
        } catch (RuntimeException e) {
            fetch = Future.failedFuture(e);
        }

        fetch.onComplete(ar -> {
            if (!settled.compareAndSet(false, true)) {
                log.info("Discarding exchange rate refresh that finished after the timeout");
                return;
            }
            vertx.cancelTimer(timerId);
            onFetched(ar, promise);
        });

        return promise.future();
    }

    private void onFetched(AsyncResult<Map<CurrencyPair, Double>> fetched, Promise<FreshnessResult> promise) {
        if (fetched.failed()) {
            Throwable cause = fetched.cause();
            log.error("Exchange rate refresh failed: {}", cause.getMessage());
            promise.fail(cause instanceof ExchangeRateException
                    ? cause
                    : new ExchangeRateException(ExchangeRateError.API_UNAVAILABLE, "Exchange rate refresh failed", cause));
            return;
        }

        refreshUseCase.applyRates(fetched.result())
                .onSuccess(v -> promise.complete(FreshnessResult.refreshed()))
                .onFailure(error -> {
                    log.error("Fetched rates could not be recorded: {}", error.getMessage());
                    promise.complete(FreshnessResult.failed());
                });
    }
}
