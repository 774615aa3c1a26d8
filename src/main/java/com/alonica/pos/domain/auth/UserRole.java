package com.alonica.pos.domain.auth;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * UserRole - 사용자 역할과 역할별 권한
 *
 * 비즈니스 규칙:
 * - ADMIN: 모든 권한 (환불/삭제 승인 포함)
 * - KASIR: 주문/오픈 빌/교대/지출 관리, 환불 및 삭제 요청
 * - KITCHEN: 주문 조회 및 조리 상태 변경
 */
public enum UserRole {
    ADMIN("관리자", EnumSet.allOf(Capability.class)),
    KASIR("캐셔", EnumSet.of(
            Capability.CREATE_ORDER,
            Capability.VIEW_ORDERS,
            Capability.UPDATE_ORDER_STATUS,
            Capability.MANAGE_OPEN_BILL,
            Capability.MANAGE_SHIFT,
            Capability.RECORD_EXPENSE,
            Capability.REQUEST_REFUND,
            Capability.REQUEST_DELETION,
            Capability.VIEW_INVENTORY)),
    KITCHEN("주방", EnumSet.of(
            Capability.VIEW_ORDERS,
            Capability.UPDATE_ORDER_STATUS,
            Capability.VIEW_INVENTORY));

    private final String displayName;
    private final Set<Capability> capabilities;

    UserRole(String displayName, Set<Capability> capabilities) {
        this.displayName = displayName;
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * 헤더 값에서 역할 변환 (대소문자 무시, "cashier"는 KASIR로 취급)
     *
     * @throws IllegalArgumentException 알 수 없는 역할
     */
    public static UserRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("역할 값이 비어 있습니다");
        }
        String normalized = value.trim().toUpperCase();
        if ("CASHIER".equals(normalized)) {
            return KASIR;
        }
        return Arrays.stream(values())
                .filter(role -> role.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 역할입니다: " + value));
    }
}
