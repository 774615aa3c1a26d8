package com.alonica.pos.presentation.shift.response;

import com.alonica.pos.application.shift.dto.ShiftResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 교대 근무 응답 DTO
 * 마감 집계 필드는 CLOSED 이후에만 채워진다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftResponse {
    @JsonProperty("shift_id")
    private Long shiftId;

    @JsonProperty("cashier_id")
    private Long cashierId;

    private String status;

    @JsonProperty("initial_cash")
    private Long initialCash;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("start_time")
    private LocalDateTime startTime;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("end_time")
    private LocalDateTime endTime;

    @JsonProperty("total_orders")
    private Integer totalOrders;

    @JsonProperty("total_revenue")
    private Long totalRevenue;

    @JsonProperty("total_cash_revenue")
    private Long totalCashRevenue;

    @JsonProperty("total_non_cash_revenue")
    private Long totalNonCashRevenue;

    @JsonProperty("total_refunds")
    private Long totalRefunds;

    @JsonProperty("total_cash_in")
    private Long totalCashIn;

    @JsonProperty("total_cash_out")
    private Long totalCashOut;

    @JsonProperty("total_expenses")
    private Long totalExpenses;

    @JsonProperty("system_cash")
    private Long systemCash;

    @JsonProperty("final_cash")
    private Long finalCash;

    @JsonProperty("cash_difference")
    private Long cashDifference;

    private String notes;

    @JsonProperty("audit_notes")
    private String auditNotes;

    public static ShiftResponse from(ShiftResult result) {
        return ShiftResponse.builder()
                .shiftId(result.getShiftId())
                .cashierId(result.getCashierId())
                .status(result.getStatus())
                .initialCash(result.getInitialCash())
                .startTime(result.getStartTime())
                .endTime(result.getEndTime())
                .totalOrders(result.getTotalOrders())
                .totalRevenue(result.getTotalRevenue())
                .totalCashRevenue(result.getTotalCashRevenue())
                .totalNonCashRevenue(result.getTotalNonCashRevenue())
                .totalRefunds(result.getTotalRefunds())
                .totalCashIn(result.getTotalCashIn())
                .totalCashOut(result.getTotalCashOut())
                .totalExpenses(result.getTotalExpenses())
                .systemCash(result.getSystemCash())
                .finalCash(result.getFinalCash())
                .cashDifference(result.getCashDifference())
                .notes(result.getNotes())
                .auditNotes(result.getAuditNotes())
                .build();
    }
}
