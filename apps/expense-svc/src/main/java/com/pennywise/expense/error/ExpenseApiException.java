package com.pennywise.expense.error;

public abstract class ExpenseApiException extends RuntimeException {

    private final ErrorKind kind;

    protected ExpenseApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ExpenseApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
