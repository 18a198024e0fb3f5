package com.pennywise.expense.controller;

import com.pennywise.expense.controller.dto.ExpenseCreateRequestDto;
import com.pennywise.expense.controller.dto.ExpenseResponseDto;
import com.pennywise.expense.controller.dto.MessageResponseDto;
import com.pennywise.expense.model.Expense;
import com.pennywise.expense.service.ExpenseService;
import jakarta.validation.Valid;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/expenses")
public class ExpensesController {

    static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private final ExpenseService expenseService;

    public ExpensesController(ExpenseService expenseService) {
        this.expenseService = expenseService;
    }

    @PostMapping
    public ResponseEntity<MessageResponseDto> addExpense(@RequestBody @Valid ExpenseCreateRequestDto request) {
        long id = expenseService.addExpense(request.amount(), request.category(), request.expenseDate(), request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(new MessageResponseDto("Expense added", id));
    }

    @DeleteMapping("/{expenseId}")
    public ResponseEntity<MessageResponseDto> deleteExpense(@PathVariable("expenseId") long expenseId) {
        long deleted = expenseService.deleteExpense(expenseId);
        return ResponseEntity.ok(new MessageResponseDto("Expense deleted", deleted));
    }

    @GetMapping
    public ResponseEntity<List<ExpenseResponseDto>> listExpenses(
            @RequestParam(value = "limit", required = false) Long limit
    ) {
        List<ExpenseResponseDto> body = expenseService.listRecent(limit).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(body);
    }

    private ExpenseResponseDto map(Expense expense) {
        return new ExpenseResponseDto(
                expense.id(),
                expense.amount().doubleValue(),
                expense.category(),
                expense.expenseDate().toString(),
                expense.note().orElse(null),
                CREATED_AT_FORMAT.format(expense.createdAt())
        );
    }
}
