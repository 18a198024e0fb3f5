package com.pennywise.expense.model;

/**
 * One stored expense as seen by the aggregation. The date stays textual so that rows with an
 * unparseable date can be dropped during aggregation instead of failing the read.
 */
public record AnalyticsRow(double amount, String category, String expenseDate) {
}
