package com.pennywise.expense.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExpenseResponseDto(
        long id,
        double amount,
        String category,
        @JsonProperty("expense_date") String expenseDate,
        String note,
        @JsonProperty("created_at") String createdAt
) {
}
