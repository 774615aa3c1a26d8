package com.alonica.pos.domain.shift;

/**
 * 현금 입출금 유형
 * - CASH_IN: 금고에 현금 추가 (거스름돈 보충 등)
 * - CASH_OUT: 금고에서 현금 인출 (소액 구매 등)
 */
public enum CashMovementType {
    CASH_IN,
    CASH_OUT;

    public static CashMovementType fromString(String type) {
        try {
            return CashMovementType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("유효하지 않은 현금 입출금 유형입니다: " + type);
        }
    }
}
