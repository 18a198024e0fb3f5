package com.pennywise.expense.controller.dto;

public record ErrorResponseDto(String code, String detail, String traceId) {
}
