package com.alonica.pos.domain.inventory;

/**
 * 재고 차감 백로그 처리 상태
 * - PENDING: 재시도 대기
 * - RESOLVED: 재시도 성공
 */
public enum BacklogStatus {
    PENDING,
    RESOLVED
}
