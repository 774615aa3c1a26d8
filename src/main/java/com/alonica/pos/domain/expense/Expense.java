package com.alonica.pos.domain.expense;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Expense - 캐셔가 금고 현금으로 지출한 비용
 * 교대 마감 시 현금 유출로 계산된다.
 */
@Entity
@Table(name = "expenses", indexes = @Index(name = "idx_expense_recorded_by", columnList = "recorded_by, created_at"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Expense {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "expense_id")
    private Long expenseId;

    @Column(name = "recorded_by", nullable = false)
    private Long recordedBy;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "category", nullable = false)
    private String category;

    @Column(name = "description", nullable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Expense record(Long recordedBy, long amount, String category, String description) {
        if (amount <= 0) {
            throw new IllegalArgumentException("지출 금액은 0보다 커야 합니다");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("지출 내용은 필수입니다");
        }
        return Expense.builder()
                .recordedBy(recordedBy)
                .amount(amount)
                .category(category == null || category.isBlank() ? "other" : category)
                .description(description)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
