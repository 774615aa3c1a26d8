package com.alonica.pos.domain.shift;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * ShiftReconciliation - 교대 정산 결과 (불변 값)
 *
 * systemCash = initialCash + netCashRevenue + cashIn - cashOut - cashExpenses
 * cashDifference = finalCash - systemCash (finalCash가 없으면 미리보기이므로 null)
 */
@Getter
@Builder
@ToString
public class ShiftReconciliation {

    private final long initialCash;
    private final int totalOrders;
    private final long totalRevenue;
    private final long totalCashRevenue;
    private final long totalNonCashRevenue;
    private final long cashRefunds;
    private final long nonCashRefunds;
    private final long totalRefunds;
    private final long netCashRevenue;
    private final long netNonCashRevenue;
    private final long totalCashIn;
    private final long totalCashOut;
    private final long totalExpenses;
    private final long systemCash;
    private final Long finalCash;
    private final Long cashDifference;
}
