package com.pennywise.expense.error;

import org.springframework.http.HttpStatus;

/**
 * Error kinds surfaced by the API and the HTTP status each one maps to.
 * {@link com.pennywise.expense.controller.ApiExceptionHandler} is the only place this table is read.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND"),
    STORAGE(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR");

    private final HttpStatus status;
    private final String code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
