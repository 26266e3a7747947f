package com.exrate.application.port.in;

import com.exrate.domain.model.CurrencyPair;
import io.vertx.core.Future;

import java.util.Map;

/**
 * Input port for exchange rate refresh operations
 */
public interface ExchangeRateRefreshUseCase {

    /**
     * Start the periodic refresh service
     * Performs initial refresh immediately, then schedules periodic refreshes
     */
    Future<Void> startPeriodicRefresh();

    /**
     * Stop the periodic refresh service
     */
    void stopPeriodicRefresh();

    /**
     * Fetch and apply today's rates
     */
    Future<Void> refreshRates();

    /**
     * Fetch today's rates without applying them
     */
    Future<Map<CurrencyPair, Double>> fetchLatestRates();

    /**
     * Record fetched rates in the rate history and the cache
     */
    Future<Void> applyRates(Map<CurrencyPair, Double> rates);
}
