package com.alonica.pos.application.refund;

import com.alonica.pos.application.refund.dto.RefundResult;
import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.PaymentMethod;
import com.alonica.pos.domain.refund.RefundLimitExceededException;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import com.alonica.pos.infrastructure.persistence.refund.InMemoryRefundRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RefundService 테스트")
class RefundServiceTest {

    private InMemoryOrderRepository orderRepository;
    private RefundService refundService;

    private Long paidOrderId;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        refundService = new RefundService(new InMemoryRefundRepository(), orderRepository);

        paidOrderId = orderRepository.save(Order.createCashOrder("Budi", "A1",
                List.of(OrderItem.createOrderItem(1L, "Nasi Goreng", 25000L, 2, null)), 0L)).getOrderId();
    }

    @Test
    @DisplayName("요청 → 승인 → 완료")
    void testRefundFlow() {
        // Given
        RefundResult requested = refundService.requestRefund(paidOrderId, 20000L, "cash", "salah pesanan", 7L);

        // When
        refundService.approveRefund(requested.getRefundId(), 1L);
        RefundResult completed = refundService.completeRefund(requested.getRefundId());

        // Then
        assertEquals("PENDING", requested.getStatus());
        assertEquals("COMPLETED", completed.getStatus());
        assertEquals(1L, completed.getAuthorizedBy());
        assertEquals(1, refundService.listRefunds(paidOrderId).size());
    }

    @Test
    @DisplayName("승인된 환불 합계가 주문 총액을 넘을 수 없음")
    void testRefundLimit() {
        // Given: 총액 50000
        RefundResult first = refundService.requestRefund(paidOrderId, 30000L, "cash", "rusak", 7L);
        RefundResult second = refundService.requestRefund(paidOrderId, 30000L, "non_cash", "rusak", 7L);
        refundService.approveRefund(first.getRefundId(), 1L);

        // When & Then: 남은 한도 20000
        assertThrows(RefundLimitExceededException.class,
                () -> refundService.approveRefund(second.getRefundId(), 1L));
        assertThrows(RefundLimitExceededException.class,
                () -> refundService.requestRefund(paidOrderId, 20001L, "cash", "rusak", 7L));
        assertDoesNotThrow(() -> refundService.requestRefund(paidOrderId, 20000L, "cash", "rusak", 7L));
    }

    @Test
    @DisplayName("거절된 환불은 한도를 차지하지 않음")
    void testRejectedRefundFreesLimit() {
        // Given
        RefundResult rejected = refundService.requestRefund(paidOrderId, 50000L, "cash", "batal", 7L);
        refundService.rejectRefund(rejected.getRefundId(), 1L, "tidak valid");

        // When
        RefundResult again = refundService.requestRefund(paidOrderId, 50000L, "cash", "batal", 7L);

        // Then
        assertDoesNotThrow(() -> refundService.approveRefund(again.getRefundId(), 1L));
    }

    @Test
    @DisplayName("결제되지 않은 주문은 환불 요청 불가")
    void testRefundUnpaidOrder() {
        // Given
        Long unpaidId = orderRepository.save(Order.createOpenBill("Sari", "B2",
                List.of(OrderItem.createOrderItem(1L, "Es Teh", 5000L, 1, null)), PaymentMethod.CASH)).getOrderId();

        // When
        ConflictException e = assertThrows(ConflictException.class,
                () -> refundService.requestRefund(unpaidId, 1000L, "cash", "batal", 7L));

        // Then
        assertEquals(ErrorCode.REFUND_ORDER_NOT_PAID, e.getErrorCode());
    }

    @Test
    @DisplayName("승인되지 않은 환불은 완료할 수 없음")
    void testCompleteWithoutApproval() {
        // Given
        RefundResult requested = refundService.requestRefund(paidOrderId, 1000L, "cash", "batal", 7L);

        // When & Then
        assertThrows(ConflictException.class, () -> refundService.completeRefund(requested.getRefundId()));
    }
}
