package com.exrate.domain.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Historical Rate - the rate in force when an expense was recorded
 * Immutable, keyed by (expenseId, fromCurrency, toCurrency)
 */
@Value
public class HistoricalRate {
    long expenseId;
    String fromCurrency;
    String toCurrency;
    double rate;
    LocalDateTime recordedAt;

    public CurrencyPair pair() {
        return CurrencyPair.of(fromCurrency, toCurrency);
    }
}
