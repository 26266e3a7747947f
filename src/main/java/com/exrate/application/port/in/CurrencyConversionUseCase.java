package com.exrate.application.port.in;

import com.exrate.domain.model.ConversionRequest;
import com.exrate.domain.model.ConversionResult;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for converting amounts between currencies
 */
public interface CurrencyConversionUseCase {

    /**
     * Convert an amount, preferring the expense's frozen historical rate.
     * Never fails: when no rate can be found the amount is returned unconverted.
     * @param expenseId expense the amount belongs to, or null
     */
    Future<Double> convert(double amount, String fromCurrency, String toCurrency, Long expenseId);

    /**
     * Same chain as {@link #convert}, reporting the applied rate and its source
     */
    Future<ConversionResult> convertDetailed(ConversionRequest request);

    /**
     * Same chain as {@link #convert}, but fails with API_UNAVAILABLE instead of falling back to identity
     */
    Future<Double> convertStrict(double amount, String fromCurrency, String toCurrency, Long expenseId);

    /**
     * Convert a batch of amounts, e.g. for a dashboard. Never fails.
     */
    Future<List<ConversionResult>> convertAll(List<ConversionRequest> requests);
}
