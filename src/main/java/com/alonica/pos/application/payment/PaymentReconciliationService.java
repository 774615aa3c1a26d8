package com.alonica.pos.application.payment;

import com.alonica.pos.application.hook.PostCommitHookDispatcher;
import com.alonica.pos.application.payment.dto.PaymentClientConfig;
import com.alonica.pos.application.payment.dto.PaymentStatusResult;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.PaymentStatus;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import com.alonica.pos.domain.payment.GatewayTransactionStatus;
import com.alonica.pos.domain.payment.PaymentGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * PaymentReconciliationService - 웹훅과 폴링 결과를 하나의 결제 상태로 수렴
 *
 * 두 경로 모두 merge()를 호출한다.
 * - 게이트웨이 상태 매핑 결과가 저장된 상태와 같으면 아무것도 하지 않음
 * - 다르면 저장된 상태를 기대값으로 compare-and-set (주문 단위, 전역 잠금 없음)
 * - compare-and-set에 진 호출은 다시 읽은 상태를 반환하고 부가 작업을 하지 않음
 * - PAID 전환에 성공한 호출만 매출 재집계 훅을 실행
 *
 * 나중에 결제(payLater) 주문과 이미 PAID인 주문은 게이트웨이 경로로 변경하지 않는다.
 */
@Service
public class PaymentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentReconciliationService.class);

    private final OrderRepository orderRepository;
    private final PaymentGateway paymentGateway;
    private final PostCommitHookDispatcher hookDispatcher;

    public PaymentReconciliationService(OrderRepository orderRepository,
                                        PaymentGateway paymentGateway,
                                        PostCommitHookDispatcher hookDispatcher) {
        this.orderRepository = orderRepository;
        this.paymentGateway = paymentGateway;
        this.hookDispatcher = hookDispatcher;
    }

    /**
     * 게이트웨이 거래 상태를 주문에 반영
     *
     * @param order 저장소에서 읽은 주문
     * @param transactionStatus 게이트웨이 원본 transaction_status
     */
    public PaymentStatusResult merge(Order order, String transactionStatus) {
        if (order.isPayLater()) {
            log.warn("[PaymentReconciliationService] 나중에 결제 주문은 게이트웨이로 결제되지 않음 - orderId={}, status={}",
                    order.getOrderId(), transactionStatus);
            return PaymentStatusResult.of(order, false);
        }

        PaymentStatus stored = order.getPaymentStatus();
        PaymentStatus next = PaymentStatus.fromGatewayStatus(transactionStatus);
        if (next == stored) {
            return PaymentStatusResult.of(order, false);
        }
        if (stored == PaymentStatus.PAID) {
            log.warn("[PaymentReconciliationService] 결제 완료 주문의 상태 변경 무시 - orderId={}, status={}",
                    order.getOrderId(), transactionStatus);
            return PaymentStatusResult.of(order, false);
        }

        LocalDateTime now = LocalDateTime.now();
        boolean applied = orderRepository.compareAndSetPaymentStatus(
                order.getOrderId(), stored, next, transactionStatus, now);
        Order current = orderRepository.findById(order.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(order.getOrderId()));

        if (!applied) {
            log.info("[PaymentReconciliationService] 다른 요청이 먼저 결제 상태를 변경함 - orderId={}, current={}",
                    order.getOrderId(), current.getPaymentStatus());
            return PaymentStatusResult.of(current, false);
        }

        log.info("[PaymentReconciliationService] 결제 상태 변경 - orderId={}, {} → {}, transactionStatus={}",
                order.getOrderId(), stored, next, transactionStatus);
        if (next == PaymentStatus.PAID) {
            hookDispatcher.dispatch(new OrderPaidEvent(current.getOrderId(), current.getPaymentMethod(),
                    current.getTotal(), current.getPaidAt()));
        }
        return PaymentStatusResult.of(current, true);
    }

    /**
     * 클라이언트 폴링 경로
     *
     * PENDING이고 실제 게이트웨이 주문 ID가 있을 때만 게이트웨이를 조회한다.
     * 조회가 실패하면 저장된 상태를 그대로 반환한다.
     */
    public PaymentStatusResult checkPaymentStatus(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        if (order.getPaymentStatus() != PaymentStatus.PENDING
                || order.getGatewayOrderId() == null
                || order.isMockPayment()
                || !paymentGateway.isEnabled()) {
            return PaymentStatusResult.of(order, false);
        }

        GatewayTransactionStatus status;
        try {
            status = paymentGateway.queryStatus(order.getGatewayOrderId());
        } catch (RuntimeException e) {
            log.warn("[PaymentReconciliationService] 거래 상태 조회 실패 - 저장된 상태 반환, orderId={}, error={}",
                    orderId, e.getMessage());
            return PaymentStatusResult.of(order, false);
        }
        return merge(order, status.getTransactionStatus());
    }

    public PaymentClientConfig getClientConfig() {
        return new PaymentClientConfig(paymentGateway.getClientKey(), paymentGateway.isProduction());
    }
}
