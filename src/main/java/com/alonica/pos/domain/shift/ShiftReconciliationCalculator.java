package com.alonica.pos.domain.shift;

import com.alonica.pos.domain.expense.Expense;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.PaymentMethod;
import com.alonica.pos.domain.order.PaymentStatus;
import com.alonica.pos.domain.refund.Refund;
import com.alonica.pos.domain.refund.RefundStatus;
import com.alonica.pos.domain.refund.RefundType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ShiftReconciliationCalculator - 교대 마감 정산 계산기 (순수 함수)
 *
 * 계산 순서:
 * 1. 결제 완료(PAID) + 서빙 완료(SERVED) 주문만 매출로 집계
 * 2. 결제 수단별 현금/비현금 매출 분리
 * 3. 현금 입금/출금 합계
 * 4. 지출 합계 (현금 유출)
 * 5. COMPLETED 환불을 유형별로 해당 매출에서 차감
 * 6. systemCash = initialCash + netCashRevenue + cashIn - cashOut - expenses
 * 7. cashDifference = finalCash - systemCash
 *
 * 입력 컬렉션은 호출자가 교대 기간으로 이미 걸러서 전달한다.
 * 같은 입력이면 항상 같은 결과를 돌려주므로 마감 이후 감사 시 재계산에 사용한다.
 */
public class ShiftReconciliationCalculator {

    public ShiftReconciliation calculate(long initialCash,
                                         List<Order> paidOrders,
                                         List<CashMovement> movements,
                                         List<Expense> expenses,
                                         List<Refund> refunds,
                                         Long finalCash) {
        // 1~2. 매출 집계
        List<Order> revenueOrders = paidOrders.stream()
                .filter(order -> order.getPaymentStatus() == PaymentStatus.PAID)
                .filter(order -> order.getOrderStatus() == OrderStatus.SERVED)
                .collect(Collectors.toList());

        long cashRevenue = revenueOrders.stream()
                .filter(order -> order.getPaymentMethod() == PaymentMethod.CASH)
                .mapToLong(Order::getTotal)
                .sum();
        long nonCashRevenue = revenueOrders.stream()
                .filter(order -> order.getPaymentMethod() != PaymentMethod.CASH)
                .mapToLong(Order::getTotal)
                .sum();

        // 3. 현금 입출금
        long cashIn = sumMovements(movements, CashMovementType.CASH_IN);
        long cashOut = sumMovements(movements, CashMovementType.CASH_OUT);

        // 4. 지출
        long expenseTotal = expenses.stream().mapToLong(Expense::getAmount).sum();

        // 5. 환불
        long cashRefunds = sumRefunds(refunds, RefundType.CASH);
        long nonCashRefunds = sumRefunds(refunds, RefundType.NON_CASH);
        long netCashRevenue = cashRevenue - cashRefunds;
        long netNonCashRevenue = nonCashRevenue - nonCashRefunds;

        // 6~7. 기대 현금과 차액
        long systemCash = initialCash + netCashRevenue + cashIn - cashOut - expenseTotal;
        Long difference = finalCash == null ? null : finalCash - systemCash;

        return ShiftReconciliation.builder()
                .initialCash(initialCash)
                .totalOrders(revenueOrders.size())
                .totalRevenue(cashRevenue + nonCashRevenue)
                .totalCashRevenue(cashRevenue)
                .totalNonCashRevenue(nonCashRevenue)
                .cashRefunds(cashRefunds)
                .nonCashRefunds(nonCashRefunds)
                .totalRefunds(cashRefunds + nonCashRefunds)
                .netCashRevenue(netCashRevenue)
                .netNonCashRevenue(netNonCashRevenue)
                .totalCashIn(cashIn)
                .totalCashOut(cashOut)
                .totalExpenses(expenseTotal)
                .systemCash(systemCash)
                .finalCash(finalCash)
                .cashDifference(difference)
                .build();
    }

    private long sumMovements(List<CashMovement> movements, CashMovementType type) {
        return movements.stream()
                .filter(movement -> movement.getType() == type)
                .mapToLong(CashMovement::getAmount)
                .sum();
    }

    private long sumRefunds(List<Refund> refunds, RefundType type) {
        return refunds.stream()
                .filter(refund -> refund.getStatus() == RefundStatus.COMPLETED)
                .filter(refund -> refund.getRefundType() == type)
                .mapToLong(Refund::getRefundAmount)
                .sum();
    }
}
