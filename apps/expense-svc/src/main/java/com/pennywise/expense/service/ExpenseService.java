package com.pennywise.expense.service;

import com.pennywise.expense.config.PennywiseProperties;
import com.pennywise.expense.error.ExpenseNotFoundException;
import com.pennywise.expense.model.Expense;
import com.pennywise.expense.model.NewExpense;
import com.pennywise.expense.repository.ExpenseRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ExpenseService {
    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 200;

    private final ExpenseRepository expenseRepository;
    private final ExpenseValidator expenseValidator;
    private final int defaultLimit;

    public ExpenseService(
            ExpenseRepository expenseRepository,
            ExpenseValidator expenseValidator,
            PennywiseProperties properties
    ) {
        this.expenseRepository = expenseRepository;
        this.expenseValidator = expenseValidator;
        this.defaultLimit = properties.listing().defaultLimit();
    }

    public long addExpense(Double amount, String category, String expenseDate, String note) {
        NewExpense expense = expenseValidator.validate(amount, category, expenseDate, note);
        long id = expenseRepository.insert(expense);
        log.info("Expense added id={} category={} date={}", id, expense.category(), expense.expenseDate());
        return id;
    }

    public long deleteExpense(long id) {
        long deleted = expenseRepository.deleteById(id)
                .orElseThrow(() -> new ExpenseNotFoundException(id));
        log.info("Expense deleted id={}", deleted);
        return deleted;
    }

    /**
     * @param requestedLimit may be null, in which case the configured default applies
     */
    public List<Expense> listRecent(Long requestedLimit) {
        int limit = clampLimit(requestedLimit == null ? defaultLimit : requestedLimit);
        return expenseRepository.listRecent(limit);
    }

    static int clampLimit(long requested) {
        return (int) Math.max(MIN_LIMIT, Math.min(requested, MAX_LIMIT));
    }
}
