package com.alonica.pos.domain.deletion;

import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * DeletionRequest - 오픈 빌 항목 삭제 요청 (요청자/승인자 2인 절차)
 *
 * 핵심 비즈니스 규칙:
 * - 미결제 오픈 빌(payLater)의 항목만 삭제 요청 가능
 * - itemIndex는 0부터 시작하며 요청 시점의 항목 범위 안이어야 함
 * - 마지막 남은 항목은 삭제할 수 없음 (주문 항목은 비어 있을 수 없음)
 * - 요청 시점의 항목을 스냅샷으로 보관하고, 승인 시 같은 위치의 항목과 다시 비교
 * - PENDING 상태에서만 승인/거절 가능
 */
@Entity
@Table(name = "deletion_requests", indexes = {
        @Index(name = "idx_deletion_request_status", columnList = "status"),
        @Index(name = "idx_deletion_request_order", columnList = "order_id")
})
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeletionRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "request_id")
    private Long requestId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "item_index", nullable = false)
    private Integer itemIndex;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "menuItemId", column = @Column(name = "item_menu_item_id", nullable = false)),
            @AttributeOverride(name = "name", column = @Column(name = "item_name", nullable = false)),
            @AttributeOverride(name = "unitPrice", column = @Column(name = "item_unit_price", nullable = false)),
            @AttributeOverride(name = "quantity", column = @Column(name = "item_quantity", nullable = false)),
            @AttributeOverride(name = "notes", column = @Column(name = "item_notes"))
    })
    private OrderItem itemSnapshot;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    private DeletionRequestStatus status;

    @Column(name = "requested_by", nullable = false)
    private Long requestedBy;

    @Column(name = "authorized_by")
    private Long authorizedBy;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    /**
     * 삭제 요청 생성
     *
     * @throws ConflictException 결제 완료 또는 오픈 빌이 아닌 주문
     * @throws InvalidItemIndexException 인덱스 범위 초과
     * @throws DomainException 마지막 남은 항목
     */
    public static DeletionRequest request(Order order, int itemIndex, String reason, Long requestedBy) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("삭제 사유는 필수입니다");
        }
        ensureDeletable(order);
        if (itemIndex < 0 || itemIndex >= order.getItemCount()) {
            throw new InvalidItemIndexException(order.getOrderId(), itemIndex, order.getItemCount());
        }
        if (order.getItemCount() == 1) {
            throw new DomainException(ErrorCode.LAST_ITEM_DELETION, "orderId=" + order.getOrderId());
        }
        return DeletionRequest.builder()
                .orderId(order.getOrderId())
                .itemIndex(itemIndex)
                .itemSnapshot(order.getItems().get(itemIndex))
                .reason(reason)
                .status(DeletionRequestStatus.PENDING)
                .requestedBy(requestedBy)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 승인 전 재검증: 주문 상태, 인덱스 범위, 요청 시점 스냅샷과의 일치 여부
     */
    public void verifyStillApplicable(Order order) {
        ensureDeletable(order);
        if (itemIndex >= order.getItemCount()) {
            throw new ConflictException(ErrorCode.DELETION_TARGET_CHANGED,
                    "requestId=" + requestId + ", itemIndex=" + itemIndex + ", 현재 항목 수: " + order.getItemCount());
        }
        if (order.getItemCount() == 1) {
            throw new DomainException(ErrorCode.LAST_ITEM_DELETION, "orderId=" + order.getOrderId());
        }
        if (!order.getItems().get(itemIndex).isSameLineAs(itemSnapshot)) {
            throw new ConflictException(ErrorCode.DELETION_TARGET_CHANGED,
                    "requestId=" + requestId + ", itemIndex=" + itemIndex);
        }
    }

    private static void ensureDeletable(Order order) {
        if (order.isPaid() || !order.isPayLater()) {
            throw new ConflictException(ErrorCode.DELETION_NOT_ALLOWED,
                    "orderId=" + order.getOrderId() + ", paymentStatus=" + order.getPaymentStatus());
        }
    }

    public void approve(Long authorizerId) {
        ensurePending();
        this.status = DeletionRequestStatus.APPROVED;
        this.authorizedBy = authorizerId;
        this.decidedAt = LocalDateTime.now();
    }

    public void reject(Long authorizerId, String rejectionReason) {
        ensurePending();
        this.status = DeletionRequestStatus.REJECTED;
        this.authorizedBy = authorizerId;
        this.rejectionReason = rejectionReason;
        this.decidedAt = LocalDateTime.now();
    }

    /**
     * @throws ConflictException 이미 승인/거절된 요청
     */
    public void ensurePending() {
        if (this.status != DeletionRequestStatus.PENDING) {
            throw new ConflictException(ErrorCode.DELETION_REQUEST_ALREADY_DECIDED,
                    "requestId=" + requestId + ", status=" + status);
        }
    }
}
