package com.alonica.pos.application.payment.dto;

import com.alonica.pos.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 결제 상태 조회/반영 결과
 *
 * changed: 이번 호출이 결제 상태를 실제로 변경했는지 여부
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStatusResult {
    private Long orderId;
    private String paymentStatus;
    private String orderStatus;
    private String transactionStatus;
    private Long total;
    private LocalDateTime paidAt;
    private boolean mockPayment;
    private boolean changed;

    public static PaymentStatusResult of(Order order, boolean changed) {
        return PaymentStatusResult.builder()
                .orderId(order.getOrderId())
                .paymentStatus(order.getPaymentStatus().name())
                .orderStatus(order.getOrderStatus().name())
                .transactionStatus(order.getGatewayTransactionStatus())
                .total(order.getTotal())
                .paidAt(order.getPaidAt())
                .mockPayment(order.isMockPayment())
                .changed(changed)
                .build();
    }
}
