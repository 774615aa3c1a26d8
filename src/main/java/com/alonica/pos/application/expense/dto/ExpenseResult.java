package com.alonica.pos.application.expense.dto;

import com.alonica.pos.domain.expense.Expense;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseResult {
    private Long expenseId;
    private Long recordedBy;
    private Long amount;
    private String category;
    private String description;
    private LocalDateTime createdAt;

    public static ExpenseResult from(Expense expense) {
        return ExpenseResult.builder()
                .expenseId(expense.getExpenseId())
                .recordedBy(expense.getRecordedBy())
                .amount(expense.getAmount())
                .category(expense.getCategory())
                .description(expense.getDescription())
                .createdAt(expense.getCreatedAt())
                .build();
    }
}
