package com.pennywise.expense.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.pennywise.expense.error.ExpenseStorageException;
import com.pennywise.expense.model.AnalyticsRow;
import com.pennywise.expense.model.ExpenseSummary;
import com.pennywise.expense.repository.ExpenseRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AnalyticsServiceTest {

    @Mock
    private ExpenseRepository expenseRepository;

    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        analyticsService = new AnalyticsService(expenseRepository, new ExpenseAggregator());
    }

    @Test
    void summarisesStoredRows() {
        when(expenseRepository.listAllForAnalytics()).thenReturn(List.of(
                new AnalyticsRow(120.5, "shopping", "2024-03-15"),
                new AnalyticsRow(68.25, "groceries", "2024-03-16")
        ));

        ExpenseSummary summary = analyticsService.getSummary().orElseThrow();

        assertThat(summary.totalExpenses()).isEqualTo(2);
        assertThat(summary.averageSpend()).isEqualTo(94.38);
        assertThat(summary.categoryTotals().keySet()).containsExactly("shopping", "groceries");
        assertThat(summary.monthlyTotals()).containsOnlyKeys("2024-03");
    }

    @Test
    void emptyStoreGivesNoSummary() {
        when(expenseRepository.listAllForAnalytics()).thenReturn(List.of());

        Optional<ExpenseSummary> summary = analyticsService.getSummary();

        assertThat(summary).isEmpty();
    }

    @Test
    void storageFailurePropagates() {
        when(expenseRepository.listAllForAnalytics())
                .thenThrow(new ExpenseStorageException("connection refused", null));

        assertThatThrownBy(() -> analyticsService.getSummary())
                .isInstanceOf(ExpenseStorageException.class)
                .hasMessage("connection refused");
    }
}
