package com.alonica.pos.presentation.shift.response;

import com.alonica.pos.application.shift.dto.ReconciliationResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 교대 정산 응답 DTO
 *
 * preview=true: 열린 교대의 현재 시점 미리보기 (final_cash, cash_difference 없음)
 * preview=false: 마감된 교대의 재계산 (감사용), recorded_* 는 마감 시점 저장 값
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResponse {
    @JsonProperty("shift_id")
    private Long shiftId;

    private boolean preview;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("window_start")
    private LocalDateTime windowStart;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("window_end")
    private LocalDateTime windowEnd;

    @JsonProperty("initial_cash")
    private long initialCash;

    @JsonProperty("total_orders")
    private int totalOrders;

    @JsonProperty("total_revenue")
    private long totalRevenue;

    @JsonProperty("total_cash_revenue")
    private long totalCashRevenue;

    @JsonProperty("total_non_cash_revenue")
    private long totalNonCashRevenue;

    @JsonProperty("cash_refunds")
    private long cashRefunds;

    @JsonProperty("non_cash_refunds")
    private long nonCashRefunds;

    @JsonProperty("total_refunds")
    private long totalRefunds;

    @JsonProperty("net_cash_revenue")
    private long netCashRevenue;

    @JsonProperty("net_non_cash_revenue")
    private long netNonCashRevenue;

    @JsonProperty("total_cash_in")
    private long totalCashIn;

    @JsonProperty("total_cash_out")
    private long totalCashOut;

    @JsonProperty("total_expenses")
    private long totalExpenses;

    @JsonProperty("system_cash")
    private long systemCash;

    @JsonProperty("final_cash")
    private Long finalCash;

    @JsonProperty("cash_difference")
    private Long cashDifference;

    @JsonProperty("recorded_system_cash")
    private Long recordedSystemCash;

    @JsonProperty("recorded_cash_difference")
    private Long recordedCashDifference;

    @JsonProperty("system_cash_drift")
    private Long systemCashDrift;

    public static ReconciliationResponse from(ReconciliationResult result) {
        return ReconciliationResponse.builder()
                .shiftId(result.getShiftId())
                .preview(result.isPreview())
                .windowStart(result.getWindowStart())
                .windowEnd(result.getWindowEnd())
                .initialCash(result.getInitialCash())
                .totalOrders(result.getTotalOrders())
                .totalRevenue(result.getTotalRevenue())
                .totalCashRevenue(result.getTotalCashRevenue())
                .totalNonCashRevenue(result.getTotalNonCashRevenue())
                .cashRefunds(result.getCashRefunds())
                .nonCashRefunds(result.getNonCashRefunds())
                .totalRefunds(result.getTotalRefunds())
                .netCashRevenue(result.getNetCashRevenue())
                .netNonCashRevenue(result.getNetNonCashRevenue())
                .totalCashIn(result.getTotalCashIn())
                .totalCashOut(result.getTotalCashOut())
                .totalExpenses(result.getTotalExpenses())
                .systemCash(result.getSystemCash())
                .finalCash(result.getFinalCash())
                .cashDifference(result.getCashDifference())
                .recordedSystemCash(result.getRecordedSystemCash())
                .recordedCashDifference(result.getRecordedCashDifference())
                .systemCashDrift(result.getSystemCashDrift())
                .build();
    }
}
