package com.alonica.pos.application.refund.dto;

import com.alonica.pos.domain.refund.Refund;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundResult {
    private Long refundId;
    private Long orderId;
    private Long refundAmount;
    private String refundType;
    private String reason;
    private String status;
    private Long requestedBy;
    private Long authorizedBy;
    private String rejectionReason;
    private LocalDateTime createdAt;
    private LocalDateTime processedAt;

    public static RefundResult from(Refund refund) {
        return RefundResult.builder()
                .refundId(refund.getRefundId())
                .orderId(refund.getOrderId())
                .refundAmount(refund.getRefundAmount())
                .refundType(refund.getRefundType().name())
                .reason(refund.getReason())
                .status(refund.getStatus().name())
                .requestedBy(refund.getRequestedBy())
                .authorizedBy(refund.getAuthorizedBy())
                .rejectionReason(refund.getRejectionReason())
                .createdAt(refund.getCreatedAt())
                .processedAt(refund.getProcessedAt())
                .build();
    }
}
