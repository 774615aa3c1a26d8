package com.alonica.pos.application.order.dto;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 결과 (Application layer 내부 DTO)
 * Domain의 Order 엔티티로부터 변환
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResult {
    private Long orderId;
    private String customerName;
    private String tableNumber;
    private List<OrderItemResult> items;
    private Long subtotal;
    private Long discount;
    private Long total;
    private String paymentMethod;
    private String paymentStatus;
    private String orderStatus;
    private boolean payLater;
    private String gatewayOrderId;
    private String gatewayTransactionStatus;
    private String qrisUrl;
    private String qrisString;
    private LocalDateTime paymentExpiredAt;
    private boolean mockPayment;
    private LocalDateTime paidAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static OrderResult fromOrder(Order order) {
        List<OrderItemResult> items = new ArrayList<>();
        List<OrderItem> orderItems = order.getItems();
        for (int i = 0; i < orderItems.size(); i++) {
            items.add(OrderItemResult.of(i, orderItems.get(i)));
        }
        return OrderResult.builder()
                .orderId(order.getOrderId())
                .customerName(order.getCustomerName())
                .tableNumber(order.getTableNumber())
                .items(items)
                .subtotal(order.getSubtotal())
                .discount(order.getDiscount())
                .total(order.getTotal())
                .paymentMethod(order.getPaymentMethod().name())
                .paymentStatus(order.getPaymentStatus().name())
                .orderStatus(order.getOrderStatus().name())
                .payLater(order.isPayLater())
                .gatewayOrderId(order.getGatewayOrderId())
                .gatewayTransactionStatus(order.getGatewayTransactionStatus())
                .qrisUrl(order.getQrisUrl())
                .qrisString(order.getQrisString())
                .paymentExpiredAt(order.getPaymentExpiredAt())
                .mockPayment(order.isMockPayment())
                .paidAt(order.getPaidAt())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
