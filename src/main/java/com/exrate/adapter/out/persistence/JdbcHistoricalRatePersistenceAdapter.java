package com.exrate.adapter.out.persistence;

import com.exrate.application.port.out.HistoricalRateRepository;
import com.exrate.domain.model.HistoricalRate;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLIntegrityConstraintViolationException;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of HistoricalRateRepository
 * Rows are insert-only; an existing (expense, from, to) row always wins
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcHistoricalRatePersistenceAdapter implements HistoricalRateRepository {

    private final SqlClient sqlClient;

    @Override
    public Future<Optional<HistoricalRate>> findHistoricalRate(long expenseId, String fromCurrency, String toCurrency) {
        String sql = "SELECT EXPENSE_ID, FROM_CURRENCY, TO_CURRENCY, RATE, RECORDED_AT " +
                "FROM EXPENSE_EXCHANGE_RATE " +
                "WHERE EXPENSE_ID = ? AND FROM_CURRENCY = ? AND TO_CURRENCY = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(expenseId, fromCurrency, toCurrency))
                .<Optional<HistoricalRate>>map(result -> {
                    if (result.size() > 0) {
                        return Optional.of(toHistoricalRate(result.iterator().next()));
                    }
                    return Optional.empty();
                })
                .onFailure(error -> log.error("Failed to get historical rate {}->{} for expense {}: {}",
                        fromCurrency, toCurrency, expenseId, error.getMessage()));
    }

    @Override
    public Future<Integer> countHistoricalRatesForExpense(long expenseId) {
        String sql = "SELECT COUNT(*) AS CNT FROM EXPENSE_EXCHANGE_RATE WHERE EXPENSE_ID = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(expenseId))
                .map(result -> result.iterator().next().getInteger("CNT"))
                .onFailure(error -> log.error("Failed to count historical rates for expense {}: {}", expenseId, error.getMessage()));
    }

    @Override
    public Future<Integer> createHistoricalRates(List<HistoricalRate> rates) {
        String sql = "MERGE INTO EXPENSE_EXCHANGE_RATE eer " +
                "USING (SELECT ? as EXPENSE_ID, ? as FROM_CURRENCY, ? as TO_CURRENCY, ? as RATE, ? as RECORDED_AT FROM DUAL) src " +
                "ON (eer.EXPENSE_ID = src.EXPENSE_ID AND eer.FROM_CURRENCY = src.FROM_CURRENCY AND eer.TO_CURRENCY = src.TO_CURRENCY) " +
                "WHEN NOT MATCHED THEN INSERT (EXPENSE_ID, FROM_CURRENCY, TO_CURRENCY, RATE, RECORDED_AT) " +
                "VALUES (src.EXPENSE_ID, src.FROM_CURRENCY, src.TO_CURRENCY, src.RATE, src.RECORDED_AT)";

        // Insert rows sequentially, counting the ones actually written
        Future<Integer> future = Future.succeededFuture(0);
        for (HistoricalRate rate : rates) {
            Tuple params = Tuple.of(rate.getExpenseId(), rate.getFromCurrency(), rate.getToCurrency(),
                    rate.getRate(), rate.getRecordedAt());
            future = future.compose(inserted -> sqlClient.preparedQuery(sql)
                    .execute(params)
                    .map(result -> inserted + result.rowCount())
                    .recover(error -> {
                        // a concurrent writer inserted the same key between MERGE's check and insert
                        if (isIntegrityViolation(error)) {
                            log.debug("Historical rate {} for expense {} already exists", rate.pair(), rate.getExpenseId());
                            return Future.succeededFuture(inserted);
                        }
                        return Future.failedFuture(error);
                    }));
        }

        return future
                .onSuccess(inserted -> log.debug("Inserted {} of {} historical rates", inserted, rates.size()))
                .onFailure(error -> log.error("Failed to save historical rates: {}", error.getMessage()));
    }

    private static boolean isIntegrityViolation(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
        }
        return false;
    }

    private HistoricalRate toHistoricalRate(Row row) {
        return new HistoricalRate(
                row.getLong("EXPENSE_ID"),
                row.getString("FROM_CURRENCY"),
                row.getString("TO_CURRENCY"),
                row.getDouble("RATE"),
                SqlValues.localDateTime(row, "RECORDED_AT")
        );
    }
}
