package com.pennywise.expense.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

public record Expense(
        long id,
        BigDecimal amount,
        String category,
        LocalDate expenseDate,
        Optional<String> note,
        LocalDateTime createdAt
) {
}
