package com.alonica.pos.presentation.refund.response;

import com.alonica.pos.application.refund.dto.RefundResult;
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
public class RefundResponse {
    @JsonProperty("refund_id")
    private Long refundId;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("refund_amount")
    private Long refundAmount;

    @JsonProperty("refund_type")
    private String refundType;

    private String reason;

    private String status;

    @JsonProperty("requested_by")
    private Long requestedBy;

    @JsonProperty("authorized_by")
    private Long authorizedBy;

    @JsonProperty("rejection_reason")
    private String rejectionReason;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("processed_at")
    private LocalDateTime processedAt;

    public static RefundResponse from(RefundResult result) {
        return RefundResponse.builder()
                .refundId(result.getRefundId())
                .orderId(result.getOrderId())
                .refundAmount(result.getRefundAmount())
                .refundType(result.getRefundType())
                .reason(result.getReason())
                .status(result.getStatus())
                .requestedBy(result.getRequestedBy())
                .authorizedBy(result.getAuthorizedBy())
                .rejectionReason(result.getRejectionReason())
                .createdAt(result.getCreatedAt())
                .processedAt(result.getProcessedAt())
                .build();
    }
}
