package com.pennywise.expense.health;

import com.pennywise.expense.controller.dto.MessageResponseDto;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check at the root path. Actuator health stays available for deeper checks.
 */
@RestController
public class HomeController {

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponseDto home() {
        return MessageResponseDto.of("Expense Tracker API is running");
    }
}
