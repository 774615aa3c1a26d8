package com.alonica.pos.application.shift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 교대 마감 결과 (마감된 교대 + 정산 내역)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloseShiftResult {
    private ShiftResult shift;
    private ReconciliationResult reconciliation;
}
