package com.alonica.pos.presentation.refund.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 환불 요청 DTO (refund_type: CASH | NON_CASH)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RequestRefundRequest {
    @NotNull(message = "주문 ID는 필수입니다")
    @JsonProperty("order_id")
    private Long orderId;

    @NotNull(message = "환불 금액은 필수입니다")
    @Positive(message = "환불 금액은 0보다 커야 합니다")
    @JsonProperty("refund_amount")
    private Long refundAmount;

    @NotBlank(message = "환불 유형은 필수입니다")
    @JsonProperty("refund_type")
    private String refundType;

    @NotBlank(message = "환불 사유는 필수입니다")
    private String reason;
}
