package com.pennywise.expense.analytics;

import com.pennywise.expense.model.AnalyticsRow;
import com.pennywise.expense.model.ExpenseSummary;
import com.pennywise.expense.repository.ExpenseRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class AnalyticsService {

    private final ExpenseRepository expenseRepository;
    private final ExpenseAggregator expenseAggregator;

    public AnalyticsService(ExpenseRepository expenseRepository, ExpenseAggregator expenseAggregator) {
        this.expenseRepository = expenseRepository;
        this.expenseAggregator = expenseAggregator;
    }

    public Optional<ExpenseSummary> getSummary() {
        List<AnalyticsRow> rows = expenseRepository.listAllForAnalytics();
        return expenseAggregator.aggregate(rows);
    }
}
