package com.exrate.adapter.out.persistence;

import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.domain.model.ClosestRate;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * JDBC implementation of ExchangeRateHistoryRepository
 * One row per (from, to, date), written by the daily refresh
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcExchangeRateHistoryPersistenceAdapter implements ExchangeRateHistoryRepository {

    private final SqlClient sqlClient;

    @Override
    public Future<Optional<ClosestRate>> findClosestHistoricalRateInWindow(
            String fromCurrency, String toCurrency, LocalDate date, int maxDaysDiff) {
        String sql = "SELECT RATE, RATE_DATE FROM EXCHANGE_RATE_HISTORY " +
                "WHERE FROM_CURRENCY = ? AND TO_CURRENCY = ? AND RATE_DATE BETWEEN ? AND ? AND RATE > 0";

        Tuple params = Tuple.of(fromCurrency, toCurrency,
                date.minusDays(maxDaysDiff).atStartOfDay(), date.plusDays(maxDaysDiff).atStartOfDay());

        return sqlClient.preparedQuery(sql)
                .execute(params)
                .map(result -> {
                    ClosestRate closest = null;
                    for (Row row : result) {
                        LocalDate rateDate = SqlValues.localDate(row, "RATE_DATE");
                        long days = Math.abs(ChronoUnit.DAYS.between(date, rateDate));
                        // ties go to the later date
                        if (closest == null || days < closest.getDaysDifference()
                                || (days == closest.getDaysDifference() && rateDate.isAfter(closest.getDate()))) {
                            closest = new ClosestRate(row.getDouble("RATE"), rateDate, days);
                        }
                    }
                    log.debug("Closest rate {}->{} around {}: {}", fromCurrency, toCurrency, date, closest);
                    return Optional.ofNullable(closest);
                })
                .onFailure(error -> log.error("Failed to search rate history {}->{} around {}: {}",
                        fromCurrency, toCurrency, date, error.getMessage()));
    }

    @Override
    public Future<Optional<Double>> findLastKnownRate(String fromCurrency, String toCurrency) {
        String sql = "SELECT RATE FROM EXCHANGE_RATE_HISTORY " +
                "WHERE FROM_CURRENCY = ? AND TO_CURRENCY = ? AND RATE > 0 " +
                "ORDER BY RATE_DATE DESC FETCH FIRST 1 ROWS ONLY";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(fromCurrency, toCurrency))
                .map(result -> {
                    if (result.size() == 0) {
                        return Optional.<Double>empty();
                    }
                    return Optional.ofNullable(result.iterator().next().getDouble("RATE"));
                })
                .onFailure(error -> log.error("Failed to get last known rate {}->{}: {}",
                        fromCurrency, toCurrency, error.getMessage()));
    }

    @Override
    public Future<Optional<LocalDate>> findLastUpdateDate() {
        String sql = "SELECT MAX(RATE_DATE) AS LAST_DATE FROM EXCHANGE_RATE_HISTORY";

        return sqlClient.query(sql)
                .execute()
                .map(result -> {
                    if (result.size() == 0) {
                        return Optional.<LocalDate>empty();
                    }
                    return Optional.ofNullable(SqlValues.localDate(result.iterator().next(), "LAST_DATE"));
                })
                .onFailure(error -> log.error("Failed to get last rate update date: {}", error.getMessage()));
    }

    @Override
    public Future<Void> saveRate(String fromCurrency, String toCurrency, double rate, LocalDate date) {
        LocalDateTime now = LocalDateTime.now();

        String sql = "MERGE INTO EXCHANGE_RATE_HISTORY erh " +
                "USING (SELECT ? as FROM_CURRENCY, ? as TO_CURRENCY, ? as RATE, ? as RATE_DATE, ? as UPDATE_TIME FROM DUAL) src " +
                "ON (erh.FROM_CURRENCY = src.FROM_CURRENCY AND erh.TO_CURRENCY = src.TO_CURRENCY AND erh.RATE_DATE = src.RATE_DATE) " +
                "WHEN MATCHED THEN UPDATE SET " +
                "  erh.RATE = src.RATE, " +
                "  erh.UPDATE_TIME = src.UPDATE_TIME " +
                "WHEN NOT MATCHED THEN INSERT (FROM_CURRENCY, TO_CURRENCY, RATE, RATE_DATE, UPDATE_TIME) " +
                "VALUES (src.FROM_CURRENCY, src.TO_CURRENCY, src.RATE, src.RATE_DATE, src.UPDATE_TIME)";

        Tuple params = Tuple.of(fromCurrency, toCurrency, rate, date.atStartOfDay(), now);

        return sqlClient.preparedQuery(sql)
                .execute(params)
                .onSuccess(result -> log.debug("Saved rate {}->{} for {}: {}", fromCurrency, toCurrency, date, rate))
                .onFailure(error -> log.error("Failed to save rate {}->{} for {}: {}", fromCurrency, toCurrency, date, error.getMessage()))
                .mapEmpty();
    }
}
