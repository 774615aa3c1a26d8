package com.alonica.pos.domain.inventory;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * StockDeductionBacklog - 서빙 완료 후 실패한 재고 차감 기록
 *
 * 역할:
 * - 서빙 완료 후 재고 차감이 실패해도 주문 상태 변경은 유지되므로, 실패 건을 영구 저장
 * - 스케줄러가 PENDING 건을 주기적으로 재시도
 * - 운영자가 조회하여 수동 보정 가능
 *
 * 저장 정보:
 * - orderId: 서빙 완료된 주문
 * - linesSnapshot: "menuItemId:quantity,..." 형식의 주문 항목 스냅샷
 * - reason: 마지막 실패 사유
 * - attempts: 시도 횟수 (최초 실패 포함)
 */
@Entity
@Table(name = "stock_deduction_backlog",
        indexes = {
                @Index(name = "idx_backlog_status", columnList = "status"),
                @Index(name = "idx_backlog_order_id", columnList = "order_id")
        })
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StockDeductionBacklog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "backlog_id")
    private Long backlogId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "lines_snapshot", nullable = false, length = 2048)
    private String linesSnapshot;

    @Column(name = "reason", length = 1024)
    private String reason;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    private BacklogStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public static StockDeductionBacklog create(Long orderId, String linesSnapshot, String reason) {
        LocalDateTime now = LocalDateTime.now();
        return StockDeductionBacklog.builder()
                .orderId(orderId)
                .linesSnapshot(linesSnapshot)
                .reason(reason)
                .status(BacklogStatus.PENDING)
                .attempts(1)
                .createdAt(now)
                .lastAttemptAt(now)
                .build();
    }

    public void recordFailedAttempt(String reason) {
        this.attempts++;
        this.reason = reason;
        this.lastAttemptAt = LocalDateTime.now();
    }

    public void markResolved() {
        this.status = BacklogStatus.RESOLVED;
        this.attempts++;
        this.lastAttemptAt = LocalDateTime.now();
        this.resolvedAt = this.lastAttemptAt;
    }
}
