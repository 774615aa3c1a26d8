package com.alonica.pos.application.shift.dto;

import com.alonica.pos.domain.shift.ShiftReconciliation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 교대 정산 결과 (미리보기 또는 마감 후 재계산)
 *
 * preview=true 이면 열린 교대의 현재 시점 계산이며 finalCash/cashDifference는 null
 *
 * 마감된 교대의 재계산에는 마감 시점에 저장된 값(recorded*)과 재계산 값과의 차이(systemCashDrift)가 함께 담긴다.
 * 마감 이후 서빙/환불 완료된 건이 있으면 drift가 0이 아니다.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {
    private Long shiftId;
    private boolean preview;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private long initialCash;
    private int totalOrders;
    private long totalRevenue;
    private long totalCashRevenue;
    private long totalNonCashRevenue;
    private long cashRefunds;
    private long nonCashRefunds;
    private long totalRefunds;
    private long netCashRevenue;
    private long netNonCashRevenue;
    private long totalCashIn;
    private long totalCashOut;
    private long totalExpenses;
    private long systemCash;
    private Long finalCash;
    private Long cashDifference;
    private Long recordedSystemCash;
    private Long recordedCashDifference;
    private Long systemCashDrift;

    public static ReconciliationResult of(Long shiftId, boolean preview, LocalDateTime windowStart,
                                          LocalDateTime windowEnd, ShiftReconciliation r) {
        return ReconciliationResult.builder()
                .shiftId(shiftId)
                .preview(preview)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .initialCash(r.getInitialCash())
                .totalOrders(r.getTotalOrders())
                .totalRevenue(r.getTotalRevenue())
                .totalCashRevenue(r.getTotalCashRevenue())
                .totalNonCashRevenue(r.getTotalNonCashRevenue())
                .cashRefunds(r.getCashRefunds())
                .nonCashRefunds(r.getNonCashRefunds())
                .totalRefunds(r.getTotalRefunds())
                .netCashRevenue(r.getNetCashRevenue())
                .netNonCashRevenue(r.getNetNonCashRevenue())
                .totalCashIn(r.getTotalCashIn())
                .totalCashOut(r.getTotalCashOut())
                .totalExpenses(r.getTotalExpenses())
                .systemCash(r.getSystemCash())
                .finalCash(r.getFinalCash())
                .cashDifference(r.getCashDifference())
                .build();
    }

    /**
     * 마감 시점에 저장된 정산 값 첨부
     */
    public ReconciliationResult withRecorded(Long recordedSystemCash, Long recordedCashDifference) {
        return toBuilder()
                .recordedSystemCash(recordedSystemCash)
                .recordedCashDifference(recordedCashDifference)
                .systemCashDrift(recordedSystemCash != null ? systemCash - recordedSystemCash : null)
                .build();
    }
}
