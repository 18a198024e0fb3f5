package com.pennywise.expense.controller;

import com.pennywise.expense.analytics.AnalyticsService;
import com.pennywise.expense.controller.dto.AnalyticsSummaryResponseDto;
import com.pennywise.expense.controller.dto.MessageResponseDto;
import com.pennywise.expense.model.ExpenseSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/analytics")
public class AnalyticsController {

    static final String NO_DATA_MESSAGE = "No data available";

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/summary")
    public ResponseEntity<?> getSummary() {
        return analyticsService.getSummary()
                .<ResponseEntity<?>>map(summary -> ResponseEntity.ok(map(summary)))
                .orElseGet(() -> ResponseEntity.ok(MessageResponseDto.of(NO_DATA_MESSAGE)));
    }

    private AnalyticsSummaryResponseDto map(ExpenseSummary summary) {
        return new AnalyticsSummaryResponseDto(
                summary.totalExpenses(),
                summary.averageSpend(),
                summary.maxSpend(),
                summary.categoryTotals(),
                summary.monthlyTotals()
        );
    }
}
