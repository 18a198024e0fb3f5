package com.pennywise.expense.controller;

import com.pennywise.expense.controller.dto.ErrorResponseDto;
import com.pennywise.expense.error.ErrorKind;
import com.pennywise.expense.error.ExpenseApiException;
import com.pennywise.expense.web.RequestContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ExpenseApiException.class)
    public ResponseEntity<ErrorResponseDto> handleExpenseApi(ExpenseApiException ex) {
        ErrorKind kind = ex.kind();
        if (kind.status().is5xxServerError()) {
            log.error("{}: {}", kind.code(), ex.getMessage(), ex);
        } else {
            log.warn("{}: {}", kind.code(), ex.getMessage());
        }
        return build(kind.status(), kind.code(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String detail = fieldError != null
                ? fieldError.getField() + " " + fieldError.getDefaultMessage()
                : "Invalid request body";
        return validationFailure(detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return validationFailure("Malformed JSON request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return validationFailure("Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework errors (unknown route, unsupported method) keep their own status
            HttpStatusCode statusCode = errorResponse.getStatusCode();
            HttpStatus status = HttpStatus.resolve(statusCode.value());
            return build(status != null ? status : HttpStatus.BAD_REQUEST, "REQUEST_ERROR", ex.getMessage());
        }
        log.error("Unhandled exception", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage());
    }

    private ResponseEntity<ErrorResponseDto> validationFailure(String detail) {
        log.warn("{}: {}", ErrorKind.VALIDATION.code(), detail);
        return build(ErrorKind.VALIDATION.status(), ErrorKind.VALIDATION.code(), detail);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String detail) {
        String traceId = RequestContextHolder.currentTraceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, detail, traceId));
    }
}
