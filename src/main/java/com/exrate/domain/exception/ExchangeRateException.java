package com.exrate.domain.exception;

/**
 * Base exception for exchange rate failures
 */
public class ExchangeRateException extends RuntimeException {

    private final ExchangeRateError error;
    private final String reason;

    public ExchangeRateException(ExchangeRateError error, String message) {
        super(error.getCode() + ": " + message);
        this.error = error;
        this.reason = message;
    }

    public ExchangeRateException(ExchangeRateError error, String message, Throwable cause) {
        super(error.getCode() + ": " + message, cause);
        this.error = error;
        this.reason = message;
    }

    public ExchangeRateError getError() {
        return error;
    }

    /**
     * Message without the error code prefix
     */
    public String getReason() {
        return reason;
    }

    public static ExchangeRateException rateNotFound(String fromCurrency, String toCurrency) {
        return new ExchangeRateException(ExchangeRateError.RATE_NOT_FOUND,
                "No usable rate for " + fromCurrency + " to " + toCurrency);
    }

    public static ExchangeRateException apiUnavailable(String fromCurrency, String toCurrency, Throwable cause) {
        return new ExchangeRateException(ExchangeRateError.API_UNAVAILABLE,
                "Failed to fetch rate for " + fromCurrency + " to " + toCurrency, cause);
    }

    public static ExchangeRateException databaseError(String operation, Throwable cause) {
        return new ExchangeRateException(ExchangeRateError.DATABASE_ERROR,
                operation + " failed: " + cause.getMessage(), cause);
    }
}
