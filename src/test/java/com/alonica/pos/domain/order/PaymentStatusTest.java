package com.alonica.pos.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PaymentStatus 게이트웨이 상태 매핑 테스트")
class PaymentStatusTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "settlement, PAID",
            "capture, PAID",
            "deny, FAILED",
            "cancel, FAILED",
            "failure, FAILED",
            "expire, EXPIRED",
            "pending, PENDING",
            "authorize, PENDING",
            "SETTLEMENT, PAID"
    })
    @DisplayName("transaction_status 매핑")
    void testFromGatewayStatus(String transactionStatus, PaymentStatus expected) {
        assertEquals(expected, PaymentStatus.fromGatewayStatus(transactionStatus));
    }

    @Test
    @DisplayName("null 상태는 PENDING")
    void testNullStatus() {
        assertEquals(PaymentStatus.PENDING, PaymentStatus.fromGatewayStatus(null));
    }

    @Test
    @DisplayName("주문 상태 문자열 변환 - 알 수 없는 값은 IllegalArgumentException")
    void testOrderStatusFromString() {
        assertEquals(OrderStatus.SERVED, OrderStatus.fromString("served"));
        assertThrows(IllegalArgumentException.class, () -> OrderStatus.fromString("CANCELLED"));
    }
}
