package com.alonica.pos.application.refund;

import com.alonica.pos.application.refund.dto.RefundResult;
import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.refund.Refund;
import com.alonica.pos.domain.refund.RefundNotFoundException;
import com.alonica.pos.domain.refund.RefundPolicy;
import com.alonica.pos.domain.refund.RefundRepository;
import com.alonica.pos.domain.refund.RefundType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RefundService - 환불 요청/승인/거절/완료
 *
 * 누적 한도: Σ(APPROVED + COMPLETED) ≤ 주문 총액
 * 요청 시점과 승인 시점 모두 주문 행을 잠근 상태에서 한도를 다시 확인하므로
 * 같은 주문에 대한 동시 승인이 한도를 넘지 않는다.
 */
@Service
public class RefundService {

    private static final Logger log = LoggerFactory.getLogger(RefundService.class);

    private final RefundRepository refundRepository;
    private final OrderRepository orderRepository;

    public RefundService(RefundRepository refundRepository, OrderRepository orderRepository) {
        this.refundRepository = refundRepository;
        this.orderRepository = orderRepository;
    }

    /**
     * 환불 요청
     *
     * @throws ConflictException 결제 완료되지 않은 주문 (REFUND_ORDER_NOT_PAID)
     */
    @Transactional
    public RefundResult requestRefund(Long orderId, long amount, String refundType, String reason,
                                      Long requestedBy) {
        Order order = lockPaidOrder(orderId);
        List<Refund> existing = refundRepository.findByOrderId(orderId);
        RefundPolicy.ensureWithinLimit(orderId, order.getTotal(), existing, amount);

        Refund saved = refundRepository.save(
                Refund.request(orderId, amount, RefundType.fromString(refundType), reason, requestedBy));
        log.info("[RefundService] 환불 요청 - refundId={}, orderId={}, amount={}, type={}",
                saved.getRefundId(), orderId, amount, saved.getRefundType());
        return RefundResult.from(saved);
    }

    /**
     * 환불 승인 (한도 재확인)
     */
    @Transactional
    public RefundResult approveRefund(Long refundId, Long authorizerId) {
        Refund refund = findRefund(refundId);
        Order order = lockPaidOrder(refund.getOrderId());
        List<Refund> existing = refundRepository.findByOrderId(order.getOrderId());
        RefundPolicy.ensureWithinLimit(order.getOrderId(), order.getTotal(), existing, refund.getRefundAmount());

        refund.approve(authorizerId);
        log.info("[RefundService] 환불 승인 - refundId={}, orderId={}, authorizedBy={}",
                refundId, refund.getOrderId(), authorizerId);
        return RefundResult.from(refundRepository.save(refund));
    }

    @Transactional
    public RefundResult rejectRefund(Long refundId, Long authorizerId, String rejectionReason) {
        Refund refund = findRefund(refundId);
        refund.reject(authorizerId, rejectionReason);
        log.info("[RefundService] 환불 거절 - refundId={}, authorizedBy={}", refundId, authorizerId);
        return RefundResult.from(refundRepository.save(refund));
    }

    @Transactional
    public RefundResult completeRefund(Long refundId) {
        Refund refund = findRefund(refundId);
        refund.complete();
        log.info("[RefundService] 환불 완료 - refundId={}, amount={}", refundId, refund.getRefundAmount());
        return RefundResult.from(refundRepository.save(refund));
    }

    public List<RefundResult> listRefunds(Long orderId) {
        return refundRepository.findByOrderId(orderId).stream()
                .map(RefundResult::from)
                .collect(Collectors.toList());
    }

    private Refund findRefund(Long refundId) {
        return refundRepository.findById(refundId)
                .orElseThrow(() -> new RefundNotFoundException(refundId));
    }

    private Order lockPaidOrder(Long orderId) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isPaid()) {
            throw new ConflictException(ErrorCode.REFUND_ORDER_NOT_PAID,
                    "orderId=" + orderId + ", paymentStatus=" + order.getPaymentStatus());
        }
        return order;
    }
}
