package com.alonica.pos.application.shift.dto;

import com.alonica.pos.domain.shift.Shift;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 교대 근무 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftResult {
    private Long shiftId;
    private Long cashierId;
    private String status;
    private Long initialCash;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer totalOrders;
    private Long totalRevenue;
    private Long totalCashRevenue;
    private Long totalNonCashRevenue;
    private Long totalRefunds;
    private Long totalCashIn;
    private Long totalCashOut;
    private Long totalExpenses;
    private Long systemCash;
    private Long finalCash;
    private Long cashDifference;
    private String notes;
    private String auditNotes;

    public static ShiftResult fromShift(Shift shift) {
        return ShiftResult.builder()
                .shiftId(shift.getShiftId())
                .cashierId(shift.getCashierId())
                .status(shift.getStatus().name())
                .initialCash(shift.getInitialCash())
                .startTime(shift.getStartTime())
                .endTime(shift.getEndTime())
                .totalOrders(shift.getTotalOrders())
                .totalRevenue(shift.getTotalRevenue())
                .totalCashRevenue(shift.getTotalCashRevenue())
                .totalNonCashRevenue(shift.getTotalNonCashRevenue())
                .totalRefunds(shift.getTotalRefunds())
                .totalCashIn(shift.getTotalCashIn())
                .totalCashOut(shift.getTotalCashOut())
                .totalExpenses(shift.getTotalExpenses())
                .systemCash(shift.getSystemCash())
                .finalCash(shift.getFinalCash())
                .cashDifference(shift.getCashDifference())
                .notes(shift.getNotes())
                .auditNotes(shift.getAuditNotes())
                .build();
    }
}
