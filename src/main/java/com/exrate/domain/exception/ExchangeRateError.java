package com.exrate.domain.exception;

/**
 * Error kinds raised by the exchange rate subsystem
 */
public enum ExchangeRateError {
    RATE_NOT_FOUND("HISTORICAL_RATE_NOT_FOUND"),
    API_UNAVAILABLE("EXCHANGE_API_UNAVAILABLE"),
    INVALID_CURRENCY("INVALID_CURRENCY_CODE"),
    DATABASE_ERROR("DATABASE_OPERATION_FAILED");

    private final String code;

    ExchangeRateError(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
