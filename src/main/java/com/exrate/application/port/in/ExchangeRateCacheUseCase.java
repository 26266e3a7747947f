package com.exrate.application.port.in;

import com.exrate.domain.model.CacheMetrics;

/**
 * Input port for inspecting and invalidating the exchange rate cache
 */
public interface ExchangeRateCacheUseCase {

    CacheMetrics getCacheMetrics();

    /**
     * Drop cached rates involving a currency, or every cached rate when currency is null
     * @return number of entries removed
     */
    int invalidateCache(String currency);
}
