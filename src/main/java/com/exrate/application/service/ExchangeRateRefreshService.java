package com.exrate.application.service;

import com.exrate.application.port.in.ExchangeRateRefreshUseCase;
import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.config.ExchangeRateConfig;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.CurrencyPair;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Use case implementation for exchange rate refresh operations
 * Records today's base currency rates in the rate history and warms the cache
 */
@Slf4j
public class ExchangeRateRefreshService implements ExchangeRateRefreshUseCase {

    private final Vertx vertx;
    private final LiveRateResolver liveRateResolver;
    private final ExchangeRateHistoryRepository historyRepository;
    private final ExchangeRateCache cache;
    private final ExchangeRateConfig config;
    private final Clock clock;
    private Long timerId;

    public ExchangeRateRefreshService(
            Vertx vertx,
            LiveRateResolver liveRateResolver,
            ExchangeRateHistoryRepository historyRepository,
            ExchangeRateCache cache,
            ExchangeRateConfig config,
            Clock clock
    ) {
        this.vertx = vertx;
        this.liveRateResolver = liveRateResolver;
        this.historyRepository = historyRepository;
        this.cache = cache;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Future<Void> startPeriodicRefresh() {
        long interval = config.getRefreshIntervalMs();
        log.info("Starting Exchange Rate Refresh Service (interval: {} ms)", interval);

        // Rates are advisory: a failed initial refresh does not prevent the service from starting
        return refreshRates()
                .recover(error -> {
                    log.warn("Initial exchange rate refresh failed, continuing with cached rates: {}", error.getMessage());
                    return Future.succeededFuture();
                })
                .onSuccess(v -> {
                    timerId = vertx.setPeriodic(interval, id -> {
                        log.info("Periodic exchange rate refresh triggered");
                        refreshRates()
                                .onFailure(error -> log.error("Periodic refresh failed", error));
                    });
                    log.info("Exchange Rate Refresh Service started successfully");
                });
    }

    @Override
    public void stopPeriodicRefresh() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Exchange Rate Refresh Service stopped");
        }
    }

    @Override
    public Future<Void> refreshRates() {
        log.info("Refreshing exchange rates...");

        return fetchLatestRates()
                .compose(this::applyRates)
                .onSuccess(v -> log.info("Exchange rates refreshed successfully"))
                .onFailure(error -> log.error("Failed to refresh exchange rates: {}", error.getMessage()));
    }

    @Override
    public Future<Map<CurrencyPair, Double>> fetchLatestRates() {
        List<CurrencyPair> pairs = refreshPairs();
        List<Future<Optional<Double>>> fetches = new ArrayList<>(pairs.size());
        for (CurrencyPair pair : pairs) {
            fetches.add(liveRateResolver.fetchFresh(pair.fromCurrency(), pair.toCurrency())
                    .map(Optional::of)
                    .otherwise(error -> {
                        log.warn("Could not refresh {}: {}", pair, error.getMessage());
                        return Optional.empty();
                    }));
        }

        return Future.all(fetches).compose(done -> {
            Map<CurrencyPair, Double> rates = new LinkedHashMap<>();
            for (int i = 0; i < pairs.size(); i++) {
                Optional<Double> rate = done.resultAt(i);
                CurrencyPair pair = pairs.get(i);
                rate.ifPresent(r -> rates.put(pair, r));
            }
            if (rates.isEmpty() && !pairs.isEmpty()) {
                return Future.failedFuture(new ExchangeRateException(ExchangeRateError.API_UNAVAILABLE,
                        "No exchange rate could be refreshed"));
            }
            log.info("Fetched {} of {} exchange rates", rates.size(), pairs.size());
            return Future.succeededFuture(rates);
        });
    }

    @Override
    public Future<Void> applyRates(Map<CurrencyPair, Double> rates) {
        LocalDate today = LocalDate.now(clock);
        log.info("Saving {} exchange rates for {}", rates.size(), today);

        // Save all rates sequentially
        Future<Void> future = Future.succeededFuture();
        for (Map.Entry<CurrencyPair, Double> entry : rates.entrySet()) {
            CurrencyPair pair = entry.getKey();
            future = future.compose(v ->
                    historyRepository.saveRate(pair.fromCurrency(), pair.toCurrency(), entry.getValue(), today)
            );
        }

        return future.onSuccess(v -> {
            cache.warm(rates);
            log.info("All exchange rates saved successfully");
        });
    }

    private List<CurrencyPair> refreshPairs() {
        String base = config.getBaseCurrency();
        List<CurrencyPair> pairs = new ArrayList<>();
        for (String currency : config.getSupportedCurrencies()) {
            if (!currency.equals(base)) {
                pairs.add(CurrencyPair.of(base, currency));
                pairs.add(CurrencyPair.of(currency, base));
            }
        }
        return pairs;
    }
}
