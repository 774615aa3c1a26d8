package com.alonica.pos.domain.order.event;

import com.alonica.pos.domain.order.PaymentMethod;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 주문 결제 완료 이벤트
 * 결제 상태가 PAID로 커밋된 뒤 매출 재집계 훅에 전달된다.
 */
@Getter
@ToString
public class OrderPaidEvent {

    private final Long orderId;
    private final PaymentMethod paymentMethod;
    private final Long total;
    private final LocalDateTime paidAt;

    public OrderPaidEvent(Long orderId, PaymentMethod paymentMethod, Long total, LocalDateTime paidAt) {
        this.orderId = orderId;
        this.paymentMethod = paymentMethod;
        this.total = total;
        this.paidAt = paidAt;
    }
}
