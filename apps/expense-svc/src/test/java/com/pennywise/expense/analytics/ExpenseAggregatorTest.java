package com.pennywise.expense.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.pennywise.expense.model.AnalyticsRow;
import com.pennywise.expense.model.ExpenseSummary;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExpenseAggregatorTest {

    private final ExpenseAggregator aggregator = new ExpenseAggregator();

    @Test
    void groupsByCategoryAndMonth() {
        List<AnalyticsRow> rows = List.of(
                new AnalyticsRow(100, "food", "2024-01-05"),
                new AnalyticsRow(50, "food", "2024-02-01"),
                new AnalyticsRow(30, "transport", "2024-01-20")
        );

        ExpenseSummary summary = aggregator.aggregate(rows).orElseThrow();

        assertThat(summary.totalExpenses()).isEqualTo(3);
        assertThat(summary.averageSpend()).isEqualTo(60.0);
        assertThat(summary.maxSpend()).isEqualTo(100.0);
        assertThat(summary.categoryTotals()).containsExactly(
                entry("food", 150.0),
                entry("transport", 30.0));
        assertThat(summary.monthlyTotals()).containsExactly(
                entry("2024-02", 50.0),
                entry("2024-01", 130.0));
    }

    @Test
    void emptyInputYieldsNoData() {
        assertThat(aggregator.aggregate(List.of())).isEmpty();
    }

    @Test
    void rowsWithUnparseableDatesAreSkipped() {
        List<AnalyticsRow> rows = List.of(
                new AnalyticsRow(40, "food", "2024-03-01"),
                new AnalyticsRow(999, "rent", "not-a-date"),
                new AnalyticsRow(20, "food", null)
        );

        ExpenseSummary summary = aggregator.aggregate(rows).orElseThrow();

        assertThat(summary.totalExpenses()).isEqualTo(1);
        assertThat(summary.maxSpend()).isEqualTo(40.0);
        assertThat(summary.categoryTotals()).containsOnlyKeys("food");
        assertThat(summary.monthlyTotals()).containsOnlyKeys("2024-03");
    }

    @Test
    void onlyUnparseableDatesYieldsNoData() {
        assertThat(aggregator.aggregate(List.of(new AnalyticsRow(10, "misc", "2024-13-40")))).isEmpty();
    }

    @Test
    void equalTotalsKeepFirstAppearanceOrder() {
        List<AnalyticsRow> rows = List.of(
                new AnalyticsRow(10, "books", "2024-05-02"),
                new AnalyticsRow(25, "games", "2024-04-02"),
                new AnalyticsRow(10, "coffee", "2024-06-02")
        );

        ExpenseSummary summary = aggregator.aggregate(rows).orElseThrow();

        assertThat(summary.categoryTotals().keySet()).containsExactly("games", "books", "coffee");
        assertThat(summary.monthlyTotals().keySet()).containsExactly("2024-05", "2024-06", "2024-04");
    }

    @Test
    void averageAndMaxAreRoundedToTwoDecimals() {
        List<AnalyticsRow> rows = List.of(
                new AnalyticsRow(10.005, "a", "2024-01-01"),
                new AnalyticsRow(3.333, "a", "2024-01-02"),
                new AnalyticsRow(3.333, "a", "2024-01-03")
        );

        ExpenseSummary summary = aggregator.aggregate(rows).orElseThrow();

        assertThat(summary.averageSpend()).isEqualTo(5.56);
        assertThat(summary.maxSpend()).isEqualTo(10.01);
    }

    @Test
    void aggregatingTheSameSnapshotTwiceGivesTheSameResult() {
        List<AnalyticsRow> rows = List.of(
                new AnalyticsRow(12.5, "food", "2024-01-05"),
                new AnalyticsRow(7.25, "fun", "2024-01-06"),
                new AnalyticsRow(7.25, "gym", "2023-12-31")
        );

        Optional<ExpenseSummary> first = aggregator.aggregate(rows);
        Optional<ExpenseSummary> second = aggregator.aggregate(rows);

        assertThat(first).isEqualTo(second);
        assertThat(first.orElseThrow().categoryTotals().keySet())
                .containsExactlyElementsOf(second.orElseThrow().categoryTotals().keySet());
    }

    private static java.util.Map.Entry<String, Double> entry(String key, double value) {
        return java.util.Map.entry(key, value);
    }
}
