package com.alonica.pos.presentation.shift.response;

import com.alonica.pos.application.shift.dto.CloseShiftResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CloseShiftResponse {
    private ShiftResponse shift;
    private ReconciliationResponse reconciliation;

    public static CloseShiftResponse from(CloseShiftResult result) {
        return new CloseShiftResponse(
                ShiftResponse.from(result.getShift()),
                ReconciliationResponse.from(result.getReconciliation()));
    }
}
