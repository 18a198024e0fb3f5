package com.pennywise.expense.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * A validated expense that has not been stored yet; {@code id} and {@code createdAt}
 * are assigned by the store.
 */
public record NewExpense(
        BigDecimal amount,
        String category,
        LocalDate expenseDate,
        Optional<String> note
) {
}
