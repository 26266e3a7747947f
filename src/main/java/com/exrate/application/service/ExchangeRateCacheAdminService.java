package com.exrate.application.service;

import com.exrate.application.port.in.ExchangeRateCacheUseCase;
import com.exrate.domain.model.CacheMetrics;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ExchangeRateCacheAdminService implements ExchangeRateCacheUseCase {

    private final ExchangeRateCache cache;

    @Override
    public CacheMetrics getCacheMetrics() {
        return cache.metrics();
    }

    @Override
    public int invalidateCache(String currency) {
        if (currency == null || currency.isBlank()) {
            return cache.clear();
        }
        return cache.invalidate(currency);
    }
}
