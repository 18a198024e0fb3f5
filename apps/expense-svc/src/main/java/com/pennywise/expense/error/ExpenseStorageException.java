package com.pennywise.expense.error;

/**
 * Connectivity, constraint or query failure in the persistence layer. The message is the
 * underlying driver message and is returned to the caller as-is.
 */
public class ExpenseStorageException extends ExpenseApiException {

    public ExpenseStorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
