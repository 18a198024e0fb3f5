package com.pennywise.expense.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record AnalyticsSummaryResponseDto(
        @JsonProperty("total_expenses") int totalExpenses,
        @JsonProperty("average_spend") double averageSpend,
        @JsonProperty("max_spend") double maxSpend,
        @JsonProperty("category_totals") Map<String, Double> categoryTotals,
        @JsonProperty("monthly_totals") Map<String, Double> monthlyTotals
) {
}
