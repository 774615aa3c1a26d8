package com.alonica.pos.application.shift.dto;

import com.alonica.pos.domain.shift.CashMovement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashMovementResult {
    private Long cashMovementId;
    private Long shiftId;
    private Long cashierId;
    private String type;
    private Long amount;
    private String description;
    private LocalDateTime createdAt;

    public static CashMovementResult from(CashMovement movement) {
        return CashMovementResult.builder()
                .cashMovementId(movement.getCashMovementId())
                .shiftId(movement.getShiftId())
                .cashierId(movement.getCashierId())
                .type(movement.getType().name())
                .amount(movement.getAmount())
                .description(movement.getDescription())
                .createdAt(movement.getCreatedAt())
                .build();
    }
}
