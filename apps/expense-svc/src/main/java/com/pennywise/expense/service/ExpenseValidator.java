package com.pennywise.expense.service;

import com.pennywise.expense.error.ExpenseValidationException;
import com.pennywise.expense.model.NewExpense;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns raw client input into a {@link NewExpense}. Nothing reaches the repository without
 * passing through here.
 */
@Component
public class ExpenseValidator {

    /** Matches the {@code NUMERIC(12, 2)} amount column. */
    static final int AMOUNT_SCALE = 2;
    static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");

    public NewExpense validate(Double amount, String category, String expenseDate, String note) {
        if (amount == null) {
            throw new ExpenseValidationException("amount is required");
        }
        if (amount.isNaN() || amount.isInfinite() || amount <= 0) {
            throw new ExpenseValidationException("amount must be greater than 0");
        }
        BigDecimal exact = BigDecimal.valueOf(amount);
        if (exact.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new ExpenseValidationException("amount must have at most 2 decimal places");
        }
        if (exact.compareTo(MAX_AMOUNT) > 0) {
            throw new ExpenseValidationException("amount must not exceed " + MAX_AMOUNT.toPlainString());
        }
        if (category == null || category.isBlank()) {
            throw new ExpenseValidationException("category is required");
        }
        if (expenseDate == null || expenseDate.isBlank()) {
            throw new ExpenseValidationException("expense_date is required");
        }
        return new NewExpense(
                exact,
                category,
                parseDate(expenseDate),
                Optional.ofNullable(note)
        );
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            throw new ExpenseValidationException("expense_date must be a valid date in YYYY-MM-DD format");
        }
    }
}
