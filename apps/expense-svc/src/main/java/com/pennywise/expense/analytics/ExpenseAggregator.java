package com.pennywise.expense.analytics;

import com.pennywise.expense.model.AnalyticsRow;
import com.pennywise.expense.model.ExpenseSummary;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups expense rows by category and by calendar month and computes count, mean and maximum.
 *
 * <p>Rows whose date cannot be parsed are left out of every figure. Groups with equal totals
 * keep the order in which their first row appeared. Average and maximum are rounded HALF_UP to
 * two decimals; group totals are plain double sums.
 */
@Component
public class ExpenseAggregator {
    private static final Logger log = LoggerFactory.getLogger(ExpenseAggregator.class);

    /**
     * @return empty when there is nothing to aggregate, including when every row had a bad date
     */
    public Optional<ExpenseSummary> aggregate(List<AnalyticsRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Double> byCategory = new LinkedHashMap<>();
        Map<String, Double> byMonth = new LinkedHashMap<>();
        int count = 0;
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        int skipped = 0;

        for (AnalyticsRow row : rows) {
            Optional<YearMonth> month = parseMonth(row.expenseDate());
            if (month.isEmpty()) {
                skipped++;
                continue;
            }
            double amount = row.amount();
            byCategory.merge(row.category(), amount, Double::sum);
            byMonth.merge(month.get().toString(), amount, Double::sum);
            count++;
            sum += amount;
            max = Math.max(max, amount);
        }
        if (skipped > 0) {
            log.debug("Aggregation skipped {} row(s) with unparseable dates", skipped);
        }
        if (count == 0) {
            return Optional.empty();
        }

        return Optional.of(new ExpenseSummary(
                count,
                round2(sum / count),
                round2(max),
                sortedByValue(byCategory, Map.Entry.<String, Double>comparingByValue().reversed()),
                sortedByValue(byMonth, Map.Entry.comparingByValue())
        ));
    }

    private static Optional<YearMonth> parseMonth(String date) {
        if (date == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(YearMonth.from(LocalDate.parse(date.trim())));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    // List.sort is stable, so insertion order decides ties
    private static Map<String, Double> sortedByValue(Map<String, Double> totals, Comparator<Map.Entry<String, Double>> order) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(totals.entrySet());
        entries.sort(order);
        Map<String, Double> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(sorted);
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
