package com.exrate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Cache-resident exchange rate entry
 * Owned by the cache, never persisted
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class CachedRate {
    private String fromCurrency;
    private String toCurrency;
    private double rate;
    private long fetchedAt;         // epoch millis
    private RateSource source;
    private long accessCount;
    private long lastAccessedAt;    // epoch millis

    public boolean involves(String currency) {
        return fromCurrency.equals(currency) || toCurrency.equals(currency);
    }

    public long ageMillis(long now) {
        return now - fetchedAt;
    }
}
