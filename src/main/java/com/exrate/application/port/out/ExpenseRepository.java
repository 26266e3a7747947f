package com.exrate.application.port.out;

import com.exrate.domain.model.Expense;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Output port for the (external) expense store
 */
public interface ExpenseRepository {

    Future<Optional<Expense>> findExpenseById(long expenseId);

    /**
     * Keyset page of expenses ordered by id
     * @param batchSize maximum number of expenses to return
     * @param lastProcessedId only expenses with a greater id are returned
     */
    Future<List<Expense>> findAllExpensesForMigration(int batchSize, long lastProcessedId);
}
