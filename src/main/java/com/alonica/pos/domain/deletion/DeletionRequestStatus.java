package com.alonica.pos.domain.deletion;

/**
 * 삭제 요청 상태
 * PENDING → APPROVED | REJECTED
 */
public enum DeletionRequestStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public static DeletionRequestStatus fromString(String status) {
        try {
            return DeletionRequestStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("유효하지 않은 삭제 요청 상태입니다: " + status);
        }
    }
}
