package com.alonica.pos.presentation.shift.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 현금 입출금 요청 DTO (type: CASH_IN | CASH_OUT)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CashMovementRequest {
    @NotBlank(message = "입출금 유형은 필수입니다")
    private String type;

    @NotNull(message = "금액은 필수입니다")
    @Positive(message = "금액은 0보다 커야 합니다")
    private Long amount;

    private String description;
}
