package com.alonica.pos.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 주문의 주방 진행 상태
 *
 * - QUEUED: 오픈 빌 (아직 주방으로 전달되지 않음)
 * - PENDING: 주방 대기
 * - PREPARING: 조리 중
 * - SERVED: 서빙 완료 (재료 재고 차감 시점)
 *
 * 상태 전환 규칙:
 * QUEUED → PENDING → PREPARING → SERVED (앞으로만 이동, 건너뛰기 허용)
 * 취소 상태는 없음. 결제 실패/만료는 paymentStatus로만 표현
 */
@Getter
public enum OrderStatus {
    QUEUED("오픈 빌", 0),
    PENDING("주방 대기", 1),
    PREPARING("조리 중", 2),
    SERVED("서빙 완료", 3);

    private final String displayName;
    private final int step;

    OrderStatus(String displayName, int step) {
        this.displayName = displayName;
        this.step = step;
    }

    /**
     * 목표 상태로 전환 가능한지 여부 (역방향과 같은 상태 재진입은 불가)
     */
    public boolean canTransitionTo(OrderStatus target) {
        return target != null && target.step > this.step;
    }

    /**
     * 결제 확정 시 조리 단계로 넘어갈 수 있는 대기 상태인지 여부
     */
    public boolean isWaiting() {
        return this == QUEUED || this == PENDING;
    }

    /**
     * 문자열에서 OrderStatus로 변환
     */
    public static OrderStatus fromString(String status) {
        if (status == null) {
            throw new IllegalArgumentException("주문 상태가 비어 있습니다");
        }
        try {
            return OrderStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 주문 상태입니다: " + status);
        }
    }
}
