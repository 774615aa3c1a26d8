package com.alonica.pos.presentation.shift.response;

import com.alonica.pos.application.shift.dto.CashMovementResult;
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
public class CashMovementResponse {
    @JsonProperty("cash_movement_id")
    private Long cashMovementId;

    @JsonProperty("shift_id")
    private Long shiftId;

    @JsonProperty("cashier_id")
    private Long cashierId;

    private String type;

    private Long amount;

    private String description;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static CashMovementResponse from(CashMovementResult result) {
        return CashMovementResponse.builder()
                .cashMovementId(result.getCashMovementId())
                .shiftId(result.getShiftId())
                .cashierId(result.getCashierId())
                .type(result.getType())
                .amount(result.getAmount())
                .description(result.getDescription())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
