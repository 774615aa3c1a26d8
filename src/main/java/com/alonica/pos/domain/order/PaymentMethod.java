package com.alonica.pos.domain.order;

import lombok.Getter;

/**
 * 결제 수단 (현금 / QRIS)
 */
@Getter
public enum PaymentMethod {
    CASH("현금"),
    QRIS("QRIS");

    private final String displayName;

    PaymentMethod(String displayName) {
        this.displayName = displayName;
    }

    public boolean isCash() {
        return this == CASH;
    }

    public static PaymentMethod fromString(String method) {
        try {
            return PaymentMethod.valueOf(method.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("유효하지 않은 결제 수단입니다: " + method);
        }
    }
}
