package com.alonica.pos.presentation.expense.response;

import com.alonica.pos.application.expense.dto.ExpenseResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseResponse {
    @JsonProperty("expense_id")
    private Long expenseId;

    @JsonProperty("recorded_by")
    private Long recordedBy;

    private Long amount;

    private String category;

    private String description;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static ExpenseResponse from(ExpenseResult result) {
        return ExpenseResponse.builder()
                .expenseId(result.getExpenseId())
                .recordedBy(result.getRecordedBy())
                .amount(result.getAmount())
                .category(result.getCategory())
                .description(result.getDescription())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
