package com.alonica.pos.domain.deletion;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * DeletionLog - 승인된 항목 삭제의 감사 기록 (불변)
 *
 * 삭제 전/후 항목 목록을 JSON 스냅샷으로 보관하고 요청자와 승인자를 모두 기록한다.
 */
@Entity
@Table(name = "deletion_logs", indexes = @Index(name = "idx_deletion_log_order", columnList = "order_id"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeletionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "log_id")
    private Long logId;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(name = "request_id", nullable = false, updatable = false)
    private Long requestId;

    @Column(name = "item_index", nullable = false, updatable = false)
    private Integer itemIndex;

    @Column(name = "deleted_item_name", nullable = false, updatable = false)
    private String deletedItemName;

    @Column(name = "deleted_item_quantity", nullable = false, updatable = false)
    private Integer deletedItemQuantity;

    @Column(name = "deleted_item_amount", nullable = false, updatable = false)
    private Long deletedItemAmount;

    @Column(name = "items_before", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String itemsBefore;

    @Column(name = "items_after", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String itemsAfter;

    @Column(name = "total_before", nullable = false, updatable = false)
    private Long totalBefore;

    @Column(name = "total_after", nullable = false, updatable = false)
    private Long totalAfter;

    @Column(name = "reason", nullable = false, updatable = false)
    private String reason;

    @Column(name = "requested_by", nullable = false, updatable = false)
    private Long requestedBy;

    @Column(name = "authorized_by", nullable = false, updatable = false)
    private Long authorizedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
