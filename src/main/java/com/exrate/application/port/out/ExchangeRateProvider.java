package com.exrate.application.port.out;

import io.vertx.core.Future;

/**
 * Output port for fetching live exchange rates from an external source
 * Part of hexagonal architecture - defines what the application needs
 */
public interface ExchangeRateProvider {

    /**
     * Fetch the current rate for a currency pair
     * @param fromCurrency source currency code
     * @param toCurrency target currency code
     * @return Future with the rate (1 fromCurrency = rate toCurrency), failed on any provider problem
     */
    Future<Double> fetchLiveRate(String fromCurrency, String toCurrency);
}
