package com.exrate.domain.model;

/**
 * Ordered currency pair (from -> to)
 * Currency codes are opaque, case-sensitive strings
 */
public record CurrencyPair(String fromCurrency, String toCurrency) {

    public static CurrencyPair of(String fromCurrency, String toCurrency) {
        return new CurrencyPair(fromCurrency, toCurrency);
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(toCurrency, fromCurrency);
    }

    public boolean isSameCurrency() {
        return fromCurrency.equals(toCurrency);
    }

    @Override
    public String toString() {
        return fromCurrency + "->" + toCurrency;
    }
}
