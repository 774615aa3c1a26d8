package com.alonica.pos.domain.refund;

/**
 * 환불 지급 수단
 */
public enum RefundType {
    CASH,
    NON_CASH;

    public static RefundType fromString(String type) {
        try {
            return RefundType.valueOf(type.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("유효하지 않은 환불 유형입니다: " + type);
        }
    }
}
