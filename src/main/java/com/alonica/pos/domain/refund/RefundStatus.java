package com.alonica.pos.domain.refund;

/**
 * 환불 요청 상태
 *
 * 상태 전환 규칙:
 * PENDING → APPROVED → COMPLETED
 * PENDING → REJECTED
 */
public enum RefundStatus {
    PENDING,
    APPROVED,
    REJECTED,
    COMPLETED;

    /**
     * 환불 한도 계산에 포함되는 상태인지 여부
     */
    public boolean countsTowardLimit() {
        return this == APPROVED || this == COMPLETED;
    }
}
