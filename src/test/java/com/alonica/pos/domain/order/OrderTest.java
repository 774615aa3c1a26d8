package com.alonica.pos.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 도메인 단위 테스트
 *
 * - 금액 계산: total = subtotal - discount
 * - 오픈 빌 추가/교체/결제
 * - 게이트웨이 결제 반영 시 주문 상태 이동
 * - 항목 삭제 시 빈 주문 방지
 */
@DisplayName("Order 도메인 테스트")
class OrderTest {

    private static OrderItem item(long menuItemId, String name, long price, int quantity) {
        return OrderItem.createOrderItem(menuItemId, name, price, quantity, null);
    }

    @Test
    @DisplayName("현금 주문 생성 - 즉시 PAID, paidAt 기록, 할인 반영")
    void testCreateCashOrder() {
        // When
        Order order = Order.createCashOrder("Budi", "A1",
                List.of(item(1L, "Nasi Goreng", 25000L, 2), item(2L, "Es Teh", 5000L, 1)), 5000L);

        // Then
        assertEquals(55000L, order.getSubtotal());
        assertEquals(5000L, order.getDiscount());
        assertEquals(50000L, order.getTotal());
        assertEquals(PaymentStatus.PAID, order.getPaymentStatus());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertNotNull(order.getPaidAt());
        assertFalse(order.isPayLater());
    }

    @Test
    @DisplayName("할인이 소계보다 크면 소계로 보정 - total은 0")
    void testDiscountCappedAtSubtotal() {
        // When
        Order order = Order.createCashOrder("Budi", null, List.of(item(1L, "Kopi", 10000L, 1)), 20000L);

        // Then
        assertEquals(10000L, order.getDiscount());
        assertEquals(0L, order.getTotal());
    }

    @Test
    @DisplayName("주문 항목이 비어 있으면 생성 불가")
    void testCreateWithoutItems() {
        assertThrows(InvalidOrderItemsException.class,
                () -> Order.createQrisOrder("Budi", null, List.of(), 0L));
    }

    @Test
    @DisplayName("오픈 빌 - QUEUED/UNPAID로 생성되고 항목 추가 시 소계 재계산")
    void testOpenBillAppend() {
        // Given
        Order bill = Order.createOpenBill("Meja 3", "3", List.of(item(1L, "Sate", 30000L, 1)), null);
        assertTrue(bill.isOpenBill());
        assertEquals(PaymentMethod.CASH, bill.getPaymentMethod());

        // When
        bill.appendItems(List.of(item(2L, "Es Jeruk", 8000L, 2)));

        // Then
        assertEquals(2, bill.getItemCount());
        assertEquals(46000L, bill.getSubtotal());
        assertEquals(bill.getSubtotal() - bill.getDiscount(), bill.getTotal());
    }

    @Test
    @DisplayName("오픈 빌 교체 - 결제된 빌은 OrderAlreadyPaidException")
    void testReplaceAfterPaid() {
        // Given
        Order bill = Order.createOpenBill("Meja 3", "3", List.of(item(1L, "Sate", 30000L, 1)), null);
        bill.payOpenBill(PaymentMethod.QRIS);

        // When & Then
        assertThrows(OrderAlreadyPaidException.class,
                () -> bill.replaceItems(List.of(item(2L, "Es Jeruk", 8000L, 1))));
        assertEquals(PaymentMethod.QRIS, bill.getPaymentMethod());
    }

    @Test
    @DisplayName("주방 전달 이후에는 항목을 추가할 수 없음")
    void testAppendAfterSubmit() {
        // Given
        Order bill = Order.createOpenBill("Meja 3", "3", List.of(item(1L, "Sate", 30000L, 1)), null);
        bill.submit();

        // When & Then
        assertEquals(OrderStatus.PENDING, bill.getOrderStatus());
        assertThrows(OpenBillNotOpenException.class,
                () -> bill.appendItems(List.of(item(2L, "Es Jeruk", 8000L, 1))));
    }

    @Test
    @DisplayName("오픈 빌 이중 결제는 충돌")
    void testPayOpenBillTwice() {
        // Given
        Order bill = Order.createOpenBill("Meja 3", "3", List.of(item(1L, "Sate", 30000L, 1)), null);
        bill.payOpenBill(null);

        // When & Then
        assertTrue(bill.isPaid());
        assertNotNull(bill.getPaidAt());
        assertThrows(OrderAlreadyPaidException.class, () -> bill.payOpenBill(null));
    }

    @Test
    @DisplayName("상태 전환 - 앞으로만 이동, 건너뛰기 허용, 역방향은 예외")
    void testChangeStatus() {
        // Given
        Order order = Order.createCashOrder("Budi", null, List.of(item(1L, "Kopi", 10000L, 1)), 0L);

        // When
        order.changeStatus(OrderStatus.SERVED);

        // Then
        assertEquals(OrderStatus.SERVED, order.getOrderStatus());
        assertThrows(InvalidOrderStatusException.class, () -> order.changeStatus(OrderStatus.PREPARING));
        assertThrows(InvalidOrderStatusException.class, () -> order.changeStatus(OrderStatus.SERVED));
    }

    @Test
    @DisplayName("게이트웨이 PAID 반영 - paidAt 기록 및 PENDING 주문은 PREPARING으로 이동")
    void testApplyGatewayPaid() {
        // Given
        Order order = Order.createQrisOrder("Budi", null, List.of(item(1L, "Kopi", 10000L, 1)), 0L);
        LocalDateTime now = LocalDateTime.now();

        // When
        order.applyGatewayPaymentStatus(PaymentStatus.PAID, "settlement", now);

        // Then
        assertEquals(PaymentStatus.PAID, order.getPaymentStatus());
        assertEquals(OrderStatus.PREPARING, order.getOrderStatus());
        assertEquals(now, order.getPaidAt());
        assertEquals("settlement", order.getGatewayTransactionStatus());
    }

    @Test
    @DisplayName("게이트웨이 EXPIRED 반영 - 주문 상태는 그대로")
    void testApplyGatewayExpired() {
        // Given
        Order order = Order.createQrisOrder("Budi", null, List.of(item(1L, "Kopi", 10000L, 1)), 0L);

        // When
        order.applyGatewayPaymentStatus(PaymentStatus.EXPIRED, "expire", LocalDateTime.now());

        // Then
        assertEquals(PaymentStatus.EXPIRED, order.getPaymentStatus());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertNull(order.getPaidAt());
    }

    @Test
    @DisplayName("항목 삭제 - 금액 재계산, 마지막 항목은 삭제 불가")
    void testRemoveItemAt() {
        // Given
        Order bill = Order.createOpenBill("Meja 1", "1",
                List.of(item(1L, "Sate", 30000L, 1), item(2L, "Es Jeruk", 8000L, 2)), null);

        // When
        OrderItem removed = bill.removeItemAt(1);

        // Then
        assertEquals("Es Jeruk", removed.getName());
        assertEquals(30000L, bill.getTotal());
        assertThrows(InvalidOrderItemsException.class, () -> bill.removeItemAt(0));
        assertEquals(1, bill.getItemCount());
    }
}
