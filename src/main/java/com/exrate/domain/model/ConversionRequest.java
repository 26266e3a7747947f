package com.exrate.domain.model;

/**
 * A single amount to convert; expenseId is null when the amount is not tied to an expense
 */
public record ConversionRequest(double amount, String fromCurrency, String toCurrency, Long expenseId) {

    public static ConversionRequest of(double amount, String fromCurrency, String toCurrency) {
        return new ConversionRequest(amount, fromCurrency, toCurrency, null);
    }

    public static ConversionRequest forExpense(double amount, String fromCurrency, String toCurrency, long expenseId) {
        return new ConversionRequest(amount, fromCurrency, toCurrency, expenseId);
    }

    public CurrencyPair pair() {
        return CurrencyPair.of(fromCurrency, toCurrency);
    }
}
