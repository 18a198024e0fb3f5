package com.pennywise.expense.model;

import java.util.Map;

/**
 * Aggregate statistics over all stored expenses. Both maps keep their iteration order:
 * categories by total descending, months by total ascending.
 */
public record ExpenseSummary(
        int totalExpenses,
        double averageSpend,
        double maxSpend,
        Map<String, Double> categoryTotals,
        Map<String, Double> monthlyTotals
) {
}
