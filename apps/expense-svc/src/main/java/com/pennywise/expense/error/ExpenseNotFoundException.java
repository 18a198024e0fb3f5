package com.pennywise.expense.error;

public class ExpenseNotFoundException extends ExpenseApiException {

    private final long expenseId;

    public ExpenseNotFoundException(long expenseId) {
        super(ErrorKind.NOT_FOUND, "Expense not found");
        this.expenseId = expenseId;
    }

    public long expenseId() {
        return expenseId;
    }
}
