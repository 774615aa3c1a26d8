package com.alonica.pos.application.order;

import com.alonica.pos.application.hook.PostCommitHookDispatcher;
import com.alonica.pos.application.order.dto.CashOrderResult;
import com.alonica.pos.application.order.dto.CreateOrderCommand;
import com.alonica.pos.application.order.dto.OrderLineCommand;
import com.alonica.pos.application.order.dto.OrderResult;
import com.alonica.pos.application.order.dto.OrderStatusUpdateResult;
import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.menu.MenuItem;
import com.alonica.pos.domain.menu.MenuItemUnavailableException;
import com.alonica.pos.domain.order.InvalidOrderStatusException;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import com.alonica.pos.domain.order.event.OrderServedEvent;
import com.alonica.pos.domain.payment.PaymentGateway;
import com.alonica.pos.domain.payment.PaymentGatewayException;
import com.alonica.pos.domain.payment.QrisCharge;
import com.alonica.pos.domain.payment.QrisChargeRequest;
import com.alonica.pos.infrastructure.persistence.menu.InMemoryMenuItemRepository;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * OrderService 테스트
 *
 * 메뉴/주문 저장소는 인메모리 구현, 게이트웨이와 훅 디스패처는 Mock.
 * 메뉴: 1 = Nasi Goreng 25000, 2 = Es Teh 5000, 3 = 판매 중지
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderService 테스트")
class OrderServiceTest {

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private PostCommitHookDispatcher hookDispatcher;

    private InMemoryOrderRepository orderRepository;
    private OrderService orderService;

    @BeforeEach
    void setUp() {
        InMemoryMenuItemRepository menuItemRepository = new InMemoryMenuItemRepository();
        menuItemRepository.save(MenuItem.builder().name("Nasi Goreng").price(25000L).available(true).build());
        menuItemRepository.save(MenuItem.builder().name("Es Teh").price(5000L).available(true).build());
        menuItemRepository.save(MenuItem.builder().name("Sate").price(30000L).available(false).build());

        orderRepository = new InMemoryOrderRepository();
        orderService = new OrderService(orderRepository,
                new OrderPricingService(menuItemRepository),
                new OrderTransactionService(orderRepository),
                paymentGateway,
                hookDispatcher,
                15);
    }

    private static CreateOrderCommand command(Long discount, Long received, OrderLineCommand... lines) {
        return CreateOrderCommand.builder()
                .customerName("Budi")
                .tableNumber("A1")
                .items(List.of(lines))
                .discount(discount)
                .received(received)
                .build();
    }

    private static OrderLineCommand line(long menuItemId, int quantity) {
        return new OrderLineCommand(menuItemId, quantity, null);
    }

    @Test
    @DisplayName("현금 주문 - 메뉴 가격으로 계산하고 거스름돈 반환, 매출 재집계 훅 실행")
    void testCreateCashOrder() {
        // When
        CashOrderResult result = orderService.createCashOrder(command(5000L, 60000L, line(1L, 2), line(2L, 1)));

        // Then
        assertEquals(50000L, result.getOrder().getTotal());
        assertEquals(10000L, result.getChange());
        assertEquals("PAID", result.getOrder().getPaymentStatus());
        verify(hookDispatcher).dispatch(any(OrderPaidEvent.class));
    }

    @Test
    @DisplayName("받은 금액이 합계보다 적으면 현금 주문 실패 - 저장되지 않음")
    void testCreateCashOrder_InsufficientCash() {
        // When
        DomainException e = assertThrows(DomainException.class,
                () -> orderService.createCashOrder(command(null, 20000L, line(1L, 1))));

        // Then
        assertEquals(ErrorCode.INSUFFICIENT_CASH_RECEIVED, e.getErrorCode());
        assertTrue(orderRepository.findAll(null).isEmpty());
        verifyNoInteractions(hookDispatcher);
    }

    @Test
    @DisplayName("판매 중지 메뉴는 주문 불가")
    void testCreateCashOrder_UnavailableMenu() {
        assertThrows(MenuItemUnavailableException.class,
                () -> orderService.createCashOrder(command(null, null, line(3L, 1))));
        assertThrows(MenuItemUnavailableException.class,
                () -> orderService.createCashOrder(command(null, null, line(99L, 1))));
    }

    @Test
    @DisplayName("QRIS 주문 - 게이트웨이 비활성이면 모의 결제")
    void testCreateQrisOrder_GatewayDisabled() {
        // Given
        when(paymentGateway.isEnabled()).thenReturn(false);

        // When
        OrderResult result = orderService.createQrisOrder(command(null, null, line(1L, 1)));

        // Then
        assertTrue(result.isMockPayment());
        assertEquals(QrisCharge.MOCK_QRIS_STRING, result.getQrisString());
        assertEquals("PENDING", result.getPaymentStatus());
        verify(paymentGateway, never()).createQrisCharge(any());
    }

    @Test
    @DisplayName("QRIS 주문 - 게이트웨이 오류 시 모의 결제로 대체하고 주문은 생성")
    void testCreateQrisOrder_GatewayFailureFallsBackToMock() {
        // Given
        when(paymentGateway.isEnabled()).thenReturn(true);
        when(paymentGateway.createQrisCharge(any())).thenThrow(new PaymentGatewayException("timeout"));

        // When
        OrderResult result = orderService.createQrisOrder(command(null, null, line(1L, 1)));

        // Then
        assertTrue(result.isMockPayment());
        assertNotNull(result.getOrderId());
        assertTrue(result.getGatewayOrderId().startsWith("MOCK-"));
    }

    @Test
    @DisplayName("QRIS 주문 - 게이트웨이 결제 정보 기록")
    void testCreateQrisOrder_Success() {
        // Given
        when(paymentGateway.isEnabled()).thenReturn(true);
        when(paymentGateway.createQrisCharge(any())).thenAnswer(invocation -> {
            QrisChargeRequest request = invocation.getArgument(0);
            return QrisCharge.builder()
                    .gatewayOrderId(request.getGatewayOrderId())
                    .transactionId("trx-1")
                    .transactionStatus("pending")
                    .qrisUrl("https://midtrans.test/qr.png")
                    .expiredAt(LocalDateTime.now().plusMinutes(15))
                    .mock(false)
                    .build();
        });

        // When
        OrderResult result = orderService.createQrisOrder(command(null, null, line(1L, 2)));

        // Then
        ArgumentCaptor<QrisChargeRequest> captor = ArgumentCaptor.forClass(QrisChargeRequest.class);
        verify(paymentGateway).createQrisCharge(captor.capture());
        assertEquals(50000L, captor.getValue().getGrossAmount());
        assertFalse(result.isMockPayment());
        assertTrue(result.getGatewayOrderId().matches("ALONICA-\\d+-[A-Z0-9]{5}"));
        assertEquals("https://midtrans.test/qr.png", result.getQrisUrl());
    }

    @Test
    @DisplayName("SERVED 전환 - 재고 차감 경고가 있어도 상태 변경은 유지")
    void testUpdateOrderStatus_ServedWithWarnings() {
        // Given
        Long orderId = orderService.createCashOrder(command(null, null, line(1L, 1))).getOrder().getOrderId();
        when(hookDispatcher.dispatch(any(OrderServedEvent.class)))
                .thenReturn(List.of("재고 차감 실패 (재처리 대기): Beras"));

        // When
        OrderStatusUpdateResult result = orderService.updateOrderStatus(orderId, OrderStatus.SERVED);

        // Then
        assertEquals("SERVED", result.getOrder().getOrderStatus());
        assertEquals(1, result.getWarnings().size());
        assertEquals(OrderStatus.SERVED, orderRepository.findById(orderId).orElseThrow().getOrderStatus());
    }

    @Test
    @DisplayName("역방향 상태 전환 불가")
    void testUpdateOrderStatus_Backward() {
        // Given
        Long orderId = orderService.createCashOrder(command(null, null, line(2L, 1))).getOrder().getOrderId();
        orderService.updateOrderStatus(orderId, OrderStatus.PREPARING);

        // When & Then
        assertThrows(InvalidOrderStatusException.class,
                () -> orderService.updateOrderStatus(orderId, OrderStatus.PENDING));
    }

    @Test
    @DisplayName("게이트웨이 주문 ID 형식")
    void testGenerateGatewayOrderId() {
        String id = OrderService.generateGatewayOrderId();

        assertTrue(id.matches("ALONICA-\\d+-[A-Z0-9]{5}"));
    }
}
