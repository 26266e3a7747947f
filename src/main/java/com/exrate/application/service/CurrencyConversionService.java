package com.exrate.application.service;

import com.exrate.application.port.in.CurrencyConversionUseCase;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.ConversionRequest;
import com.exrate.domain.model.ConversionResult;
import com.exrate.domain.model.ConversionSource;
import io.vertx.core.CompositeFuture;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Converts amounts between currencies.
 * <p>
 * First success wins:
 * <ol>
 *   <li>same currency: amount unchanged</li>
 *   <li>the expense's historical rate, when an expense id is given</li>
 *   <li>the current rate (cache, then live provider)</li>
 *   <li>the inverse current rate, dividing by it</li>
 *   <li>identity: amount unchanged, logged as a warning</li>
 * </ol>
 * No rounding is applied.
 */
@Slf4j
public class CurrencyConversionService implements CurrencyConversionUseCase {

    private final HistoricalRateStore historicalRateStore;
    private final LiveRateResolver liveRateResolver;

    public CurrencyConversionService(HistoricalRateStore historicalRateStore, LiveRateResolver liveRateResolver) {
        this.historicalRateStore = historicalRateStore;
        this.liveRateResolver = liveRateResolver;
    }

    @Override
    public Future<Double> convert(double amount, String fromCurrency, String toCurrency, Long expenseId) {
        if (fromCurrency.equals(toCurrency)) {
            return Future.succeededFuture(amount);
        }
        return convertDetailed(new ConversionRequest(amount, fromCurrency, toCurrency, expenseId))
                .map(ConversionResult::convertedAmount);
    }

    @Override
    public Future<ConversionResult> convertDetailed(ConversionRequest request) {
        return resolve(request)
                .otherwise(error -> {
                    log.warn("No exchange rate available for {}, returning amount {} unconverted: {}",
                            request.pair(), request.amount(), error.getMessage());
                    return ConversionResult.identityFallback(request);
                });
    }

    @Override
    public Future<Double> convertStrict(double amount, String fromCurrency, String toCurrency, Long expenseId) {
        ConversionRequest request = new ConversionRequest(amount, fromCurrency, toCurrency, expenseId);
        return resolve(request)
                .map(ConversionResult::convertedAmount)
                .recover(error -> Future.failedFuture(new ExchangeRateException(ExchangeRateError.API_UNAVAILABLE,
                        "Failed to convert " + request.pair(), error)));
    }

    @Override
    public Future<List<ConversionResult>> convertAll(List<ConversionRequest> requests) {
        List<Future<ConversionResult>> conversions = requests.stream()
                .map(this::convertDetailed)
                .toList();

        return Future.all(conversions)
                .map(CompositeFuture::<ConversionResult>list)
                .onSuccess(results -> {
                    long approximate = results.stream().filter(ConversionResult::isApproximate).count();
                    if (approximate > 0) {
                        log.warn("{} of {} amounts could not be converted and are shown unconverted",
                                approximate, results.size());
                    }
                });
    }

    private Future<ConversionResult> resolve(ConversionRequest request) {
        if (request.fromCurrency().equals(request.toCurrency())) {
            return Future.succeededFuture(ConversionResult.sameCurrency(request));
        }

        return historicalRate(request)
                .compose(historical -> historical.isPresent()
                        ? Future.<ConversionResult>succeededFuture(result(request, historical.get(), ConversionSource.HISTORICAL))
                        : fromCurrentRate(request));
    }

    private Future<Optional<Double>> historicalRate(ConversionRequest request) {
        if (request.expenseId() == null) {
            return Future.succeededFuture(Optional.empty());
        }

        return historicalRateStore.get(request.expenseId(), request.fromCurrency(), request.toCurrency())
                .otherwise(error -> {
                    log.warn("Historical rate lookup failed for expense {} {}, using current rate: {}",
                            request.expenseId(), request.pair(), error.getMessage());
                    return Optional.empty();
                });
    }

    private Future<ConversionResult> fromCurrentRate(ConversionRequest request) {
        String from = request.fromCurrency();
        String to = request.toCurrency();

        return liveRateResolver.currentRate(from, to)
                .map(rate -> result(request, rate, ConversionSource.CURRENT))
                .recover(directError -> {
                    log.debug("Direct rate {} unavailable ({}), trying inverse", request.pair(), directError.getMessage());
                    return liveRateResolver.currentRate(to, from)
                            .compose(inverseRate -> inverseRate != 0
                                    ? Future.<ConversionResult>succeededFuture(new ConversionResult(
                                            request.amount(), request.amount() / inverseRate, from, to,
                                            1.0 / inverseRate, ConversionSource.INVERSE))
                                    : Future.<ConversionResult>failedFuture(ExchangeRateException.rateNotFound(from, to)));
                });
    }

    private static ConversionResult result(ConversionRequest request, double rate, ConversionSource source) {
        return new ConversionResult(request.amount(), request.amount() * rate,
                request.fromCurrency(), request.toCurrency(), rate, source);
    }
}
