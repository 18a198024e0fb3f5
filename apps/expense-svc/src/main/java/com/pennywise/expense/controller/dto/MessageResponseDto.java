package com.pennywise.expense.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponseDto(String message, Long id) {

    public static MessageResponseDto of(String message) {
        return new MessageResponseDto(message, null);
    }
}
