package com.alonica.pos.domain.order;

import lombok.Getter;

/**
 * PaymentStatus - 주문의 결제 상태
 *
 * - PENDING: 게이트웨이 결제 대기
 * - PAID: 결제 완료
 * - FAILED: 거절/취소/실패
 * - EXPIRED: 결제 기한 만료
 * - UNPAID: 오픈 빌 (나중에 결제)
 */
@Getter
public enum PaymentStatus {
    PENDING("결제 대기"),
    PAID("결제 완료"),
    FAILED("결제 실패"),
    EXPIRED("결제 만료"),
    UNPAID("미결제");

    private final String displayName;

    PaymentStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 게이트웨이 transaction_status 값을 내부 결제 상태로 매핑
     *
     * settlement, capture → PAID
     * deny, cancel, failure → FAILED
     * expire → EXPIRED
     * 그 외 (pending, authorize 등) → PENDING
     */
    public static PaymentStatus fromGatewayStatus(String transactionStatus) {
        if (transactionStatus == null) {
            return PENDING;
        }
        switch (transactionStatus.trim().toLowerCase()) {
            case "settlement":
            case "capture":
                return PAID;
            case "deny":
            case "cancel":
            case "failure":
                return FAILED;
            case "expire":
                return EXPIRED;
            default:
                return PENDING;
        }
    }

    public static PaymentStatus fromString(String status) {
        try {
            return PaymentStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("유효하지 않은 결제 상태입니다: " + status);
        }
    }
}
