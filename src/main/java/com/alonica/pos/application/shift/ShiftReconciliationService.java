package com.alonica.pos.application.shift;

import com.alonica.pos.domain.expense.Expense;
import com.alonica.pos.domain.expense.ExpenseRepository;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.refund.Refund;
import com.alonica.pos.domain.refund.RefundRepository;
import com.alonica.pos.domain.refund.RefundStatus;
import com.alonica.pos.domain.shift.CashMovement;
import com.alonica.pos.domain.shift.CashMovementRepository;
import com.alonica.pos.domain.shift.Shift;
import com.alonica.pos.domain.shift.ShiftReconciliation;
import com.alonica.pos.domain.shift.ShiftReconciliationCalculator;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 교대 기간의 원장(주문, 현금 입출금, 지출, 환불)을 모아 정산 계산기에 전달
 *
 * 마감 트랜잭션과 감사용 재계산이 같은 수집 규칙을 사용한다.
 * - 주문: paidAt ∈ [start, end]
 * - 현금 입출금: 해당 교대
 * - 지출: 캐셔가 기간 안에 기록한 것
 * - 환불: 캐셔가 기간 안에 요청했고 COMPLETED 인 것
 */
@Component
public class ShiftReconciliationService {

    private final OrderRepository orderRepository;
    private final CashMovementRepository cashMovementRepository;
    private final ExpenseRepository expenseRepository;
    private final RefundRepository refundRepository;
    private final ShiftReconciliationCalculator calculator;

    public ShiftReconciliationService(OrderRepository orderRepository,
                                      CashMovementRepository cashMovementRepository,
                                      ExpenseRepository expenseRepository,
                                      RefundRepository refundRepository,
                                      ShiftReconciliationCalculator calculator) {
        this.orderRepository = orderRepository;
        this.cashMovementRepository = cashMovementRepository;
        this.expenseRepository = expenseRepository;
        this.refundRepository = refundRepository;
        this.calculator = calculator;
    }

    public ShiftReconciliation reconcile(Shift shift, LocalDateTime windowEnd, Long finalCash) {
        LocalDateTime windowStart = shift.getStartTime();
        List<Order> paidOrders = orderRepository.findPaidBetween(windowStart, windowEnd);
        List<CashMovement> movements = cashMovementRepository.findByShiftId(shift.getShiftId());
        List<Expense> expenses = expenseRepository.findByRecordedByBetween(
                shift.getCashierId(), windowStart, windowEnd);
        List<Refund> refunds = refundRepository.findByRequestedByAndStatusBetween(
                shift.getCashierId(), RefundStatus.COMPLETED, windowStart, windowEnd);

        return calculator.calculate(shift.getInitialCash(), paidOrders, movements, expenses, refunds, finalCash);
    }
}
