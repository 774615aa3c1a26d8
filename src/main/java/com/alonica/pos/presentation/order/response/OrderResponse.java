package com.alonica.pos.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO (Presentation layer)
 *
 * 책임:
 * - HTTP API 응답 직렬화 (@JsonProperty, @JsonFormat)
 * - Application layer와 독립적 (변환은 OrderMapper에서 처리)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("table_number")
    private String tableNumber;

    private List<OrderItemResponse> items;

    private Long subtotal;

    private Long discount;

    private Long total;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("payment_status")
    private String paymentStatus;

    @JsonProperty("order_status")
    private String orderStatus;

    @JsonProperty("pay_later")
    private boolean payLater;

    @JsonProperty("gateway_order_id")
    private String gatewayOrderId;

    @JsonProperty("gateway_transaction_status")
    private String gatewayTransactionStatus;

    @JsonProperty("qris_url")
    private String qrisUrl;

    @JsonProperty("qris_string")
    private String qrisString;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("payment_expired_at")
    private LocalDateTime paymentExpiredAt;

    @JsonProperty("mock_payment")
    private boolean mockPayment;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("paid_at")
    private LocalDateTime paidAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;
}
