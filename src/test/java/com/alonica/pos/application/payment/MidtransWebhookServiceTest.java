package com.alonica.pos.application.payment;

import com.alonica.pos.application.hook.PostCommitHookDispatcher;
import com.alonica.pos.application.payment.dto.WebhookResult;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.PaymentStatus;
import com.alonica.pos.domain.payment.PaymentGateway;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MidtransWebhookService 테스트")
class MidtransWebhookServiceTest {

    private static final String SETTLEMENT_BODY = "{\"order_id\":\"ALONICA-5001\",\"status_code\":\"200\","
            + "\"gross_amount\":\"50000.00\",\"signature_key\":\"abc\",\"transaction_status\":\"settlement\","
            + "\"transaction_id\":\"trx-1\",\"fraud_status\":\"accept\",\"payment_type\":\"qris\"}";

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private PostCommitHookDispatcher hookDispatcher;

    private InMemoryOrderRepository orderRepository;
    private MidtransWebhookService webhookService;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        PaymentReconciliationService reconciliationService =
                new PaymentReconciliationService(orderRepository, paymentGateway, hookDispatcher);
        webhookService = new MidtransWebhookService(new ObjectMapper(), paymentGateway, orderRepository,
                reconciliationService);
    }

    private Order savePendingOrder(String gatewayOrderId) {
        Order order = Order.createQrisOrder("Budi", null,
                List.of(OrderItem.createOrderItem(1L, "Nasi Goreng", 25000L, 2, null)), 0L);
        order.attachGatewayCharge(gatewayOrderId, "trx-1", "pending", null, null,
                LocalDateTime.now().plusMinutes(15), false);
        return orderRepository.save(order);
    }

    @Test
    @DisplayName("서명이 맞는 settlement 웹훅 - 주문이 PAID로 전환")
    void testHandle_Settlement() {
        // Given
        Order order = savePendingOrder("ALONICA-5001");
        when(paymentGateway.verifySignature("ALONICA-5001", "200", "50000.00", "abc")).thenReturn(true);

        // When
        WebhookResult result = webhookService.handle(SETTLEMENT_BODY);

        // Then
        assertTrue(result.isApplied());
        assertEquals("PAID", result.getMessage());
        assertEquals(PaymentStatus.PAID,
                orderRepository.findById(order.getOrderId()).orElseThrow().getPaymentStatus());
    }

    @Test
    @DisplayName("같은 웹훅이 두 번 와도 훅은 한 번만 실행")
    void testHandle_Duplicate() {
        // Given
        savePendingOrder("ALONICA-5001");
        when(paymentGateway.verifySignature("ALONICA-5001", "200", "50000.00", "abc")).thenReturn(true);

        // When
        webhookService.handle(SETTLEMENT_BODY);
        WebhookResult second = webhookService.handle(SETTLEMENT_BODY);

        // Then
        assertTrue(second.isApplied());
        verify(hookDispatcher, times(1)).dispatch(any());
    }

    @Test
    @DisplayName("서명 불일치 - 반영하지 않고 수신 확인만")
    void testHandle_InvalidSignature() {
        // Given
        Order order = savePendingOrder("ALONICA-5001");
        when(paymentGateway.verifySignature(anyString(), anyString(), anyString(), anyString())).thenReturn(false);

        // When
        WebhookResult result = webhookService.handle(SETTLEMENT_BODY);

        // Then
        assertFalse(result.isApplied());
        assertEquals(PaymentStatus.PENDING,
                orderRepository.findById(order.getOrderId()).orElseThrow().getPaymentStatus());
    }

    @Test
    @DisplayName("파싱할 수 없는 본문과 필수 필드 누락 - 예외 없이 무시")
    void testHandle_Unparsable() {
        assertFalse(webhookService.handle("not-json").isApplied());
        assertFalse(webhookService.handle("{\"order_id\":\"ALONICA-5001\"}").isApplied());
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("알 수 없는 주문 - OrderNotFoundException")
    void testHandle_UnknownOrder() {
        // Given
        when(paymentGateway.verifySignature(anyString(), anyString(), anyString(), anyString())).thenReturn(true);

        // When & Then
        assertThrows(OrderNotFoundException.class, () -> webhookService.handle(SETTLEMENT_BODY));
    }
}
