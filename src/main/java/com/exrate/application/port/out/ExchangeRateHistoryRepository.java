package com.exrate.application.port.out;

import com.exrate.domain.model.ClosestRate;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Output port for the general, date-keyed rate history
 */
public interface ExchangeRateHistoryRepository {

    /**
     * Find the recorded rate closest to a date
     * @param maxDaysDiff window size in days on either side of the date
     */
    Future<Optional<ClosestRate>> findClosestHistoricalRateInWindow(
            String fromCurrency, String toCurrency, LocalDate date, int maxDaysDiff);

    /**
     * Most recently recorded positive rate of a pair, whatever its date
     */
    Future<Optional<Double>> findLastKnownRate(String fromCurrency, String toCurrency);

    /**
     * Date of the most recent recorded rate, empty when the history is empty
     */
    Future<Optional<LocalDate>> findLastUpdateDate();

    /**
     * Save or update the rate of a pair for a date
     */
    Future<Void> saveRate(String fromCurrency, String toCurrency, double rate, LocalDate date);
}
