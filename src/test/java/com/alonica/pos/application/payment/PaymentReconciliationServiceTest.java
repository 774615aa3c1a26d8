package com.alonica.pos.application.payment;

import com.alonica.pos.application.hook.PostCommitHookDispatcher;
import com.alonica.pos.application.payment.dto.PaymentStatusResult;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.PaymentStatus;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import com.alonica.pos.domain.payment.GatewayTransactionStatus;
import com.alonica.pos.domain.payment.PaymentGateway;
import com.alonica.pos.domain.payment.PaymentGatewayException;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * PaymentReconciliationService 테스트
 *
 * 저장소는 인메모리 구현을 사용하고 게이트웨이와 훅 디스패처만 Mock 처리한다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentReconciliationService 테스트")
class PaymentReconciliationServiceTest {

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private PostCommitHookDispatcher hookDispatcher;

    private InMemoryOrderRepository orderRepository;
    private PaymentReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        reconciliationService = new PaymentReconciliationService(orderRepository, paymentGateway, hookDispatcher);
    }

    private Order savePendingQrisOrder(String gatewayOrderId, boolean mock) {
        Order order = Order.createQrisOrder("Budi", "A1",
                List.of(OrderItem.createOrderItem(1L, "Nasi Goreng", 25000L, 2, null)), 0L);
        order.attachGatewayCharge(gatewayOrderId, "trx-1", "pending", null, "qris-string",
                LocalDateTime.now().plusMinutes(15), mock);
        return orderRepository.save(order);
    }

    @Test
    @DisplayName("웹훅 settlement 반영 후 같은 상태의 폴링 결과는 아무것도 바꾸지 않음")
    void testMerge_WebhookThenPoll_Idempotent() {
        // Given
        Order order = savePendingQrisOrder("ALONICA-1", false);

        // When
        PaymentStatusResult first = reconciliationService.merge(order, "settlement");
        Order reloaded = orderRepository.findById(order.getOrderId()).orElseThrow();
        PaymentStatusResult second = reconciliationService.merge(reloaded, "settlement");

        // Then
        assertTrue(first.isChanged());
        assertFalse(second.isChanged());
        assertEquals("PAID", second.getPaymentStatus());
        assertEquals(OrderStatus.PREPARING, reloaded.getOrderStatus());
        assertNotNull(reloaded.getPaidAt());
        verify(hookDispatcher, times(1)).dispatch(any(OrderPaidEvent.class));
    }

    @Test
    @DisplayName("이미 PAID인 주문에 expire가 와도 결제 상태는 그대로")
    void testMerge_PaidIsTerminal() {
        // Given
        Order order = savePendingQrisOrder("ALONICA-2", false);
        reconciliationService.merge(order, "settlement");

        // When
        PaymentStatusResult result = reconciliationService.merge(
                orderRepository.findById(order.getOrderId()).orElseThrow(), "expire");

        // Then
        assertFalse(result.isChanged());
        assertEquals(PaymentStatus.PAID, orderRepository.findById(order.getOrderId()).orElseThrow().getPaymentStatus());
    }

    @Test
    @DisplayName("expire 반영 - 결제 상태만 EXPIRED, 주문 상태와 훅은 그대로")
    void testMerge_Expire() {
        // Given
        Order order = savePendingQrisOrder("ALONICA-3", false);

        // When
        PaymentStatusResult result = reconciliationService.merge(order, "expire");

        // Then
        assertTrue(result.isChanged());
        assertEquals("EXPIRED", result.getPaymentStatus());
        assertEquals("PENDING", result.getOrderStatus());
        verifyNoInteractions(hookDispatcher);
    }

    @Test
    @DisplayName("폴링 - 게이트웨이 조회 결과로 결제 상태 반영")
    void testCheckPaymentStatus_Polls() {
        // Given
        Order order = savePendingQrisOrder("ALONICA-4", false);
        when(paymentGateway.isEnabled()).thenReturn(true);
        when(paymentGateway.queryStatus("ALONICA-4")).thenReturn(GatewayTransactionStatus.builder()
                .gatewayOrderId("ALONICA-4")
                .transactionStatus("settlement")
                .build());

        // When
        PaymentStatusResult result = reconciliationService.checkPaymentStatus(order.getOrderId());

        // Then
        assertTrue(result.isChanged());
        assertEquals("PAID", result.getPaymentStatus());
    }

    @Test
    @DisplayName("폴링 - 조회 실패 시 저장된 상태 반환")
    void testCheckPaymentStatus_GatewayFailure() {
        // Given
        Order order = savePendingQrisOrder("ALONICA-5", false);
        when(paymentGateway.isEnabled()).thenReturn(true);
        when(paymentGateway.queryStatus("ALONICA-5")).thenThrow(new PaymentGatewayException("timeout"));

        // When
        PaymentStatusResult result = reconciliationService.checkPaymentStatus(order.getOrderId());

        // Then
        assertFalse(result.isChanged());
        assertEquals("PENDING", result.getPaymentStatus());
    }

    @Test
    @DisplayName("폴링 - 모의 결제 주문은 게이트웨이를 조회하지 않음")
    void testCheckPaymentStatus_MockPayment() {
        // Given
        Order order = savePendingQrisOrder("MOCK-1", true);

        // When
        PaymentStatusResult result = reconciliationService.checkPaymentStatus(order.getOrderId());

        // Then
        assertTrue(result.isMockPayment());
        verify(paymentGateway, never()).queryStatus(any());
    }
}
