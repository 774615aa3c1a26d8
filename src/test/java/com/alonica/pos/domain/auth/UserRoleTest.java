package com.alonica.pos.domain.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UserRole 권한 테스트")
class UserRoleTest {

    @ParameterizedTest
    @EnumSource(Capability.class)
    @DisplayName("ADMIN은 모든 권한 보유")
    void testAdmin_HasEverything(Capability capability) {
        assertTrue(UserRole.ADMIN.can(capability));
    }

    @Test
    @DisplayName("KASIR는 요청만 가능하고 승인/보고서 권한 없음")
    void testKasir() {
        assertTrue(UserRole.KASIR.can(Capability.REQUEST_REFUND));
        assertTrue(UserRole.KASIR.can(Capability.REQUEST_DELETION));
        assertFalse(UserRole.KASIR.can(Capability.AUTHORIZE_REFUND));
        assertFalse(UserRole.KASIR.can(Capability.AUTHORIZE_DELETION));
        assertFalse(UserRole.KASIR.can(Capability.VIEW_REPORTS));
    }

    @Test
    @DisplayName("KITCHEN은 주문 생성과 교대 관리 불가")
    void testKitchen() {
        assertTrue(UserRole.KITCHEN.can(Capability.UPDATE_ORDER_STATUS));
        assertFalse(UserRole.KITCHEN.can(Capability.CREATE_ORDER));
        assertFalse(UserRole.KITCHEN.can(Capability.MANAGE_SHIFT));
    }

    @ParameterizedTest
    @ValueSource(strings = {"kasir", "KASIR", " cashier ", "Cashier"})
    @DisplayName("헤더 값 변환 - 대소문자 무시, cashier 별칭 허용")
    void testFromString_Kasir(String value) {
        assertEquals(UserRole.KASIR, UserRole.fromString(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "owner"})
    @DisplayName("알 수 없는 역할은 예외")
    void testFromString_Invalid(String value) {
        assertThrows(IllegalArgumentException.class, () -> UserRole.fromString(value));
    }

    @Test
    @DisplayName("Actor는 역할 권한을 위임")
    void testActor() {
        Actor actor = Actor.of(7L, UserRole.KITCHEN);
        assertFalse(actor.can(Capability.CREATE_ORDER));
        assertFalse(actor.isAdmin());
        assertTrue(Actor.of(1L, UserRole.ADMIN).isAdmin());
    }
}
