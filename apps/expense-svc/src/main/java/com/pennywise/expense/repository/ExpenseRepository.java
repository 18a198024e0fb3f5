package com.pennywise.expense.repository;

import com.pennywise.expense.model.AnalyticsRow;
import com.pennywise.expense.model.Expense;
import com.pennywise.expense.model.NewExpense;
import java.util.List;
import java.util.Optional;

/**
 * Storage of expense records. Implementations report failures as
 * {@link com.pennywise.expense.error.ExpenseStorageException}.
 */
public interface ExpenseRepository {

    /**
     * @return the identifier assigned by the store
     */
    long insert(NewExpense expense);

    /**
     * @return the removed id, or empty when no record had that id
     */
    Optional<Long> deleteById(long id);

    /**
     * Most recently created first. Callers are expected to pass an already clamped limit.
     */
    List<Expense> listRecent(int limit);

    List<AnalyticsRow> listAllForAnalytics();
}
