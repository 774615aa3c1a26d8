package com.alonica.pos.domain.refund;

import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.common.exception.ConflictException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Refund - 결제 완료 주문에 대한 환불 요청
 *
 * 핵심 비즈니스 규칙:
 * - 한 주문의 APPROVED + COMPLETED 환불 합계는 주문 총액을 넘을 수 없음
 * - 승인/거절은 PENDING 상태에서만, 완료는 APPROVED 상태에서만 가능
 */
@Entity
@Table(name = "refunds", indexes = {
        @Index(name = "idx_refund_order", columnList = "order_id"),
        @Index(name = "idx_refund_requested_by", columnList = "requested_by, created_at")
})
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Refund {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "refund_id")
    private Long refundId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "refund_amount", nullable = false)
    private Long refundAmount;

    @Column(name = "refund_type", nullable = false)
    @Enumerated(EnumType.STRING)
    private RefundType refundType;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    private RefundStatus status;

    @Column(name = "requested_by", nullable = false)
    private Long requestedBy;

    @Column(name = "authorized_by")
    private Long authorizedBy;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public static Refund request(Long orderId, long refundAmount, RefundType refundType, String reason,
                                 Long requestedBy) {
        if (refundAmount <= 0) {
            throw new IllegalArgumentException("환불 금액은 0보다 커야 합니다");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("환불 사유는 필수입니다");
        }
        return Refund.builder()
                .orderId(orderId)
                .refundAmount(refundAmount)
                .refundType(refundType)
                .reason(reason)
                .status(RefundStatus.PENDING)
                .requestedBy(requestedBy)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public void approve(Long authorizerId) {
        requireStatus(RefundStatus.PENDING);
        this.status = RefundStatus.APPROVED;
        this.authorizedBy = authorizerId;
        this.processedAt = LocalDateTime.now();
    }

    public void reject(Long authorizerId, String rejectionReason) {
        requireStatus(RefundStatus.PENDING);
        this.status = RefundStatus.REJECTED;
        this.authorizedBy = authorizerId;
        this.rejectionReason = rejectionReason;
        this.processedAt = LocalDateTime.now();
    }

    public void complete() {
        requireStatus(RefundStatus.APPROVED);
        this.status = RefundStatus.COMPLETED;
        this.processedAt = LocalDateTime.now();
    }

    private void requireStatus(RefundStatus expected) {
        if (this.status != expected) {
            throw new ConflictException(ErrorCode.INVALID_REFUND_STATUS,
                    "refundId=" + refundId + ", 현재 상태: " + status + ", 필요 상태: " + expected);
        }
    }
}
