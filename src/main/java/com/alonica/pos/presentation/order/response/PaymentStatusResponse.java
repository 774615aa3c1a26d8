package com.alonica.pos.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStatusResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("payment_status")
    private String paymentStatus;

    @JsonProperty("order_status")
    private String orderStatus;

    @JsonProperty("transaction_status")
    private String transactionStatus;

    private Long total;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("paid_at")
    private LocalDateTime paidAt;

    @JsonProperty("mock_payment")
    private boolean mockPayment;

    private boolean changed;
}
