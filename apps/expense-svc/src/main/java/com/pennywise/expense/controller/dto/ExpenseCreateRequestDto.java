package com.pennywise.expense.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

public record ExpenseCreateRequestDto(
        Double amount,
        @Size(max = 255) String category,
        @JsonProperty("expense_date") String expenseDate,
        @Size(max = 1000) String note
) {
}
