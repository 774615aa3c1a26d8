package com.alonica.pos.domain.shift;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Shift - 캐셔 교대 근무 엔티티
 *
 * 책임:
 * - 근무 시작 시 시재금(initialCash) 기록
 * - 마감 시 정산 결과 저장 (한 번만 마감 가능)
 *
 * 핵심 비즈니스 규칙:
 * - 캐셔당 OPEN 상태의 교대는 최대 1개
 * - cashDifference = finalCash - systemCash
 * - 마감 이후에는 감사 메모(auditNotes)만 추가 가능
 */
@Entity
@Table(name = "shifts", indexes = @Index(name = "idx_shift_cashier_status", columnList = "cashier_id, status"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "shift_id")
    private Long shiftId;

    @Column(name = "cashier_id", nullable = false)
    private Long cashierId;

    @Column(name = "initial_cash", nullable = false)
    private Long initialCash;

    @Column(name = "start_time", nullable = false, updatable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    private ShiftStatus status;

    @Column(name = "total_orders")
    private Integer totalOrders;

    @Column(name = "total_revenue")
    private Long totalRevenue;

    @Column(name = "total_cash_revenue")
    private Long totalCashRevenue;

    @Column(name = "total_non_cash_revenue")
    private Long totalNonCashRevenue;

    @Column(name = "total_refunds")
    private Long totalRefunds;

    @Column(name = "total_cash_in")
    private Long totalCashIn;

    @Column(name = "total_cash_out")
    private Long totalCashOut;

    @Column(name = "total_expenses")
    private Long totalExpenses;

    @Column(name = "system_cash")
    private Long systemCash;

    @Column(name = "final_cash")
    private Long finalCash;

    @Column(name = "cash_difference")
    private Long cashDifference;

    @Column(name = "notes", length = 1024)
    private String notes;

    @Column(name = "audit_notes", length = 4096)
    private String auditNotes;

    /**
     * 교대 시작
     */
    public static Shift open(Long cashierId, long initialCash) {
        if (cashierId == null) {
            throw new IllegalArgumentException("캐셔 ID는 필수입니다");
        }
        if (initialCash < 0) {
            throw new IllegalArgumentException("시재금은 음수가 될 수 없습니다");
        }
        return Shift.builder()
                .cashierId(cashierId)
                .initialCash(initialCash)
                .startTime(LocalDateTime.now())
                .status(ShiftStatus.OPEN)
                .build();
    }

    public boolean isOpen() {
        return status == ShiftStatus.OPEN;
    }

    public boolean isOwnedBy(Long userId) {
        return cashierId.equals(userId);
    }

    /**
     * 열린 교대인지 확인
     *
     * @throws ShiftNotOpenException 이미 마감된 교대
     */
    public void ensureOpen() {
        if (!isOpen()) {
            throw new ShiftNotOpenException(shiftId);
        }
    }

    /**
     * 교대 마감 (정산 결과 기록)
     */
    public void close(ShiftReconciliation reconciliation, String notes, LocalDateTime endTime) {
        ensureOpen();
        this.status = ShiftStatus.CLOSED;
        this.endTime = endTime;
        this.totalOrders = reconciliation.getTotalOrders();
        this.totalRevenue = reconciliation.getTotalRevenue();
        this.totalCashRevenue = reconciliation.getTotalCashRevenue();
        this.totalNonCashRevenue = reconciliation.getTotalNonCashRevenue();
        this.totalRefunds = reconciliation.getTotalRefunds();
        this.totalCashIn = reconciliation.getTotalCashIn();
        this.totalCashOut = reconciliation.getTotalCashOut();
        this.totalExpenses = reconciliation.getTotalExpenses();
        this.systemCash = reconciliation.getSystemCash();
        this.finalCash = reconciliation.getFinalCash();
        this.cashDifference = reconciliation.getCashDifference();
        this.notes = notes;
    }

    /**
     * 감사 메모 추가 (마감 이후 유일하게 허용되는 변경)
     */
    public void addAuditNote(Long auditorId, String note) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("감사 메모는 비어 있을 수 없습니다");
        }
        String line = "[" + LocalDateTime.now() + "] user=" + auditorId + " " + note.trim();
        this.auditNotes = auditNotes == null ? line : auditNotes + "\n" + line;
    }
}
