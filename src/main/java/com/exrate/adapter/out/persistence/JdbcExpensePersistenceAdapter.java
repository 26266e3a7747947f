package com.exrate.adapter.out.persistence;

import com.exrate.application.port.out.ExpenseRepository;
import com.exrate.domain.model.Expense;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ExpenseRepository
 * Read-only: expenses are owned by the expense tracker
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcExpensePersistenceAdapter implements ExpenseRepository {

    private static final String COLUMNS = "ID, AMOUNT, CURRENCY, EXPENSE_DATE, CONVERSION_RATE";

    private final SqlClient sqlClient;

    @Override
    public Future<Optional<Expense>> findExpenseById(long expenseId) {
        String sql = "SELECT " + COLUMNS + " FROM EXPENSE WHERE ID = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(expenseId))
                .<Optional<Expense>>map(result -> {
                    if (result.size() > 0) {
                        return Optional.of(toExpense(result.iterator().next()));
                    }
                    log.debug("Expense {} not found", expenseId);
                    return Optional.empty();
                })
                .onFailure(error -> log.error("Failed to find expense {}: {}", expenseId, error.getMessage()));
    }

    @Override
    public Future<List<Expense>> findAllExpensesForMigration(int batchSize, long lastProcessedId) {
        String sql = "SELECT " + COLUMNS + " FROM EXPENSE WHERE ID > ? ORDER BY ID FETCH FIRST ? ROWS ONLY";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(lastProcessedId, batchSize))
                .map(result -> {
                    List<Expense> expenses = new ArrayList<>(result.size());
                    result.forEach(row -> expenses.add(toExpense(row)));
                    log.debug("Loaded {} expenses after id {}", expenses.size(), lastProcessedId);
                    return expenses;
                })
                .onFailure(error -> log.error("Failed to load expenses after id {}: {}", lastProcessedId, error.getMessage()));
    }

    private Expense toExpense(Row row) {
        return Expense.builder()
                .id(row.getLong("ID"))
                .amount(row.getDouble("AMOUNT"))
                .currency(row.getString("CURRENCY"))
                .date(SqlValues.localDateTime(row, "EXPENSE_DATE"))
                .conversionRate(SqlValues.nullableDouble(row, "CONVERSION_RATE"))
                .build();
    }
}
