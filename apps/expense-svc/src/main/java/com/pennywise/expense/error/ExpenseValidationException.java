package com.pennywise.expense.error;

public class ExpenseValidationException extends ExpenseApiException {

    public ExpenseValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
