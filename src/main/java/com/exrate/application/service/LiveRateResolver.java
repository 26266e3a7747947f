package com.exrate.application.service;

import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.application.port.out.ExchangeRateProvider;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.CurrencyPair;
import com.exrate.domain.model.RateSource;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Single gateway to the live rate provider.
 * Only positive, finite rates come out of here; anything else is reported as RATE_NOT_FOUND
 * and therefore never reaches the cache or the database.
 * <p>
 * When the provider fails, {@link #currentRate} falls back to the last rate recorded in the
 * rate history (cached as {@link RateSource#DATABASE}) and then to the configured static rates
 * (cached as {@link RateSource#FALLBACK}).
 */
@Slf4j
@RequiredArgsConstructor
public class LiveRateResolver {

    private final ExchangeRateCache cache;
    private final ExchangeRateProvider provider;
    private final ExchangeRateHistoryRepository historyRepository;
    private final Map<CurrencyPair, Double> fallbackRates;

    /**
     * Current rate for a pair: the cache when fresh, then the provider, then the last recorded rate,
     * then the configured static rate. Fails with the provider's error when none of them has one.
     */
    public Future<Double> currentRate(String fromCurrency, String toCurrency) {
        if (fromCurrency.equals(toCurrency)) {
            return Future.succeededFuture(1.0);
        }
        return cache.getOrFetch(fromCurrency, toCurrency, () -> fetchFresh(fromCurrency, toCurrency), false)
                .recover(error -> lastKnownRate(fromCurrency, toCurrency, error));
    }

    /**
     * Rate straight from the provider, bypassing the cache
     */
    public Future<Double> fetchFresh(String fromCurrency, String toCurrency) {
        if (fromCurrency.equals(toCurrency)) {
            return Future.succeededFuture(1.0);
        }

        Future<Double> call;
        try {
            call = provider.fetchLiveRate(fromCurrency, toCurrency);
        } catch (RuntimeException e) {
            call = Future.failedFuture(e);
        }
        if (call == null) {
            call = Future.failedFuture("Provider returned no result");
        }

        return call
                .recover(error -> Future.failedFuture(error instanceof ExchangeRateException
                        ? error
                        : ExchangeRateException.apiUnavailable(fromCurrency, toCurrency, error)))
                .compose(rate -> {
                    if (rate == null || !(rate > 0) || rate.isInfinite()) {
                        log.warn("Provider returned unusable rate {} for {}->{}", rate, fromCurrency, toCurrency);
                        return Future.failedFuture(ExchangeRateException.rateNotFound(fromCurrency, toCurrency));
                    }
                    log.debug("Fetched live rate {}->{}: {}", fromCurrency, toCurrency, rate);
                    return Future.succeededFuture(rate);
                });
    }

    private Future<Double> lastKnownRate(String fromCurrency, String toCurrency, Throwable providerError) {
        Future<Optional<Double>> lookup;
        try {
            lookup = historyRepository.findLastKnownRate(fromCurrency, toCurrency);
        } catch (RuntimeException e) {
            lookup = Future.failedFuture(e);
        }
        if (lookup == null) {
            lookup = Future.succeededFuture(Optional.empty());
        }

        return lookup
                .recover(error -> {
                    log.warn("Last known rate lookup for {}->{} failed: {}", fromCurrency, toCurrency, error.getMessage());
                    return Future.succeededFuture(Optional.<Double>empty());
                })
                .compose(stored -> {
                    if (stored.isEmpty() || !(stored.get() > 0) || stored.get().isInfinite()) {
                        return staticRate(fromCurrency, toCurrency, providerError);
                    }
                    double rate = stored.get();
                    log.warn("Live rate {}->{} unavailable ({}), using last recorded rate {}",
                            fromCurrency, toCurrency, providerError.getMessage(), rate);
                    cache.set(fromCurrency, toCurrency, rate, RateSource.DATABASE);
                    return Future.succeededFuture(rate);
                });
    }

    private Future<Double> staticRate(String fromCurrency, String toCurrency, Throwable providerError) {
        Double rate = fallbackRates.get(CurrencyPair.of(fromCurrency, toCurrency));
        if (rate == null) {
            return Future.failedFuture(providerError);
        }
        log.warn("No live or recorded rate for {}->{}, using approximate fallback rate {}", fromCurrency, toCurrency, rate);
        cache.set(fromCurrency, toCurrency, rate, RateSource.FALLBACK);
        return Future.succeededFuture(rate);
    }
}
