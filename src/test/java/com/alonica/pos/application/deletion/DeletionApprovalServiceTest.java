package com.alonica.pos.application.deletion;

import com.alonica.pos.application.deletion.dto.DeletionDecisionResult;
import com.alonica.pos.application.deletion.dto.DeletionRequestResult;
import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.deletion.DeletionNotificationSink;
import com.alonica.pos.domain.deletion.DeletionRequest;
import com.alonica.pos.domain.deletion.DeletionRequestStatus;
import com.alonica.pos.domain.deletion.InvalidItemIndexException;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.PaymentMethod;
import com.alonica.pos.infrastructure.persistence.deletion.InMemoryDeletionLogRepository;
import com.alonica.pos.infrastructure.persistence.deletion.InMemoryDeletionRequestRepository;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DeletionApprovalService 테스트
 *
 * 오픈 빌: [0] Ayam Bakar 30000 x1, [1] Es Jeruk 8000 x2 → total 46000
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DeletionApprovalService 테스트")
class DeletionApprovalServiceTest {

    @Mock
    private DeletionNotificationSink notificationSink;

    private InMemoryOrderRepository orderRepository;
    private DeletionApprovalService deletionApprovalService;

    private Long orderId;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        InMemoryDeletionRequestRepository requestRepository = new InMemoryDeletionRequestRepository();
        InMemoryDeletionLogRepository logRepository = new InMemoryDeletionLogRepository();
        DeletionTransactionService transactionService = new DeletionTransactionService(
                requestRepository, logRepository, orderRepository, new ObjectMapper());
        deletionApprovalService = new DeletionApprovalService(transactionService, requestRepository,
                logRepository, notificationSink);

        orderId = orderRepository.save(Order.createOpenBill("Sari", "B2", List.of(
                OrderItem.createOrderItem(1L, "Ayam Bakar", 30000L, 1, null),
                OrderItem.createOrderItem(2L, "Es Jeruk", 8000L, 2, null)), PaymentMethod.CASH)).getOrderId();
    }

    @Test
    @DisplayName("승인 - 항목 삭제, 금액 재계산, 감사 로그 기록")
    void testApprove() {
        // Given
        DeletionRequestResult requested = deletionApprovalService.requestDeletion(orderId, 1, "salah input", 7L);

        // When
        DeletionDecisionResult decision = deletionApprovalService.approve(requested.getRequestId(), 1L);

        // Then
        assertEquals("PENDING", requested.getStatus());
        assertEquals(16000L, requested.getItemAmount());
        assertEquals("APPROVED", decision.getRequest().getStatus());
        assertEquals(1, decision.getOrder().getItems().size());
        assertEquals(30000L, decision.getOrder().getTotal());
        assertEquals(46000L, decision.getLog().getTotalBefore());
        assertEquals(30000L, decision.getLog().getTotalAfter());
        assertEquals("Es Jeruk", decision.getLog().getDeletedItemName());
        assertTrue(decision.getLog().getItemsBefore().contains("Es Jeruk"));
        assertFalse(decision.getLog().getItemsAfter().contains("Es Jeruk"));
        assertEquals(1, deletionApprovalService.listLogs().size());
        verify(notificationSink).deletionRequested(any(DeletionRequest.class));
        verify(notificationSink).deletionDecided(any(DeletionRequest.class));
    }

    @Test
    @DisplayName("같은 요청을 두 번 승인 - 두 번째는 이미 결정됨, 항목은 한 번만 삭제")
    void testApproveTwice_SecondRejectedBeforeOrderChanges() {
        // Given
        Long twinOrderId = orderRepository.save(Order.createOpenBill("Sari", "B3", List.of(
                OrderItem.createOrderItem(3L, "Es Teh", 5000L, 1, null),
                OrderItem.createOrderItem(3L, "Es Teh", 5000L, 1, null),
                OrderItem.createOrderItem(4L, "Nasi", 7000L, 1, null)), PaymentMethod.CASH)).getOrderId();
        DeletionRequestResult requested = deletionApprovalService.requestDeletion(twinOrderId, 0, "salah input", 7L);
        deletionApprovalService.approve(requested.getRequestId(), 1L);

        // When
        ConflictException e = assertThrows(ConflictException.class,
                () -> deletionApprovalService.approve(requested.getRequestId(), 1L));

        // Then
        assertEquals(ErrorCode.DELETION_REQUEST_ALREADY_DECIDED, e.getErrorCode());
        assertEquals(2, orderRepository.findById(twinOrderId).orElseThrow().getItemCount());
        assertEquals(12000L, orderRepository.findById(twinOrderId).orElseThrow().getTotal());
        assertEquals(1, deletionApprovalService.listLogs().size());
    }

    @Test
    @DisplayName("동시 승인 4건 - 동일 항목 6개 중 정확히 하나만 삭제")
    void testConcurrentApprove_RemovesExactlyOneItem() throws InterruptedException {
        // Given
        List<OrderItem> items = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            items.add(OrderItem.createOrderItem(3L, "Es Teh", 5000L, 1, null));
        }
        Long twinOrderId = orderRepository.save(
                Order.createOpenBill("Sari", "B4", items, PaymentMethod.CASH)).getOrderId();
        Long requestId = deletionApprovalService.requestDeletion(twinOrderId, 0, "salah input", 7L).getRequestId();

        int threadCount = 4;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger approvedCount = new AtomicInteger();
        AtomicInteger conflictCount = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    deletionApprovalService.approve(requestId, 1L);
                    approvedCount.incrementAndGet();
                } catch (ConflictException e) {
                    conflictCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executorService.shutdown();

        // Then
        assertEquals(1, approvedCount.get());
        assertEquals(3, conflictCount.get());
        assertEquals(5, orderRepository.findById(twinOrderId).orElseThrow().getItemCount());
        assertEquals(1, deletionApprovalService.listLogs().size());
    }

    @Test
    @DisplayName("2개 항목 주문에서 인덱스 2 삭제 요청 - 범위 초과로 거절")
    void testRequest_IndexOutOfRange() {
        assertThrows(InvalidItemIndexException.class,
                () -> deletionApprovalService.requestDeletion(orderId, 2, "salah input", 7L));
        assertTrue(deletionApprovalService.listRequests(null).isEmpty());
    }

    @Test
    @DisplayName("거절 - 주문은 변경되지 않고 로그도 남지 않음")
    void testReject() {
        // Given
        DeletionRequestResult requested = deletionApprovalService.requestDeletion(orderId, 0, "salah input", 7L);

        // When
        DeletionDecisionResult decision = deletionApprovalService.reject(requested.getRequestId(), 1L, "tetap");

        // Then
        assertEquals("REJECTED", decision.getRequest().getStatus());
        assertNull(decision.getOrder());
        assertNull(decision.getLog());
        assertEquals(2, orderRepository.findById(orderId).orElseThrow().getItemCount());
        assertTrue(deletionApprovalService.listLogs().isEmpty());
        assertEquals(1, deletionApprovalService.listRequests(DeletionRequestStatus.REJECTED).size());
    }

    @Test
    @DisplayName("요청 이후 결제된 주문은 승인 불가")
    void testApprove_OrderPaidAfterRequest() {
        // Given
        DeletionRequestResult requested = deletionApprovalService.requestDeletion(orderId, 0, "salah input", 7L);
        orderRepository.findById(orderId).orElseThrow().payOpenBill(PaymentMethod.CASH);

        // When
        ConflictException e = assertThrows(ConflictException.class,
                () -> deletionApprovalService.approve(requested.getRequestId(), 1L));

        // Then
        assertEquals(ErrorCode.DELETION_NOT_ALLOWED, e.getErrorCode());
        assertEquals(2, orderRepository.findById(orderId).orElseThrow().getItemCount());
    }

    @Test
    @DisplayName("알림 전달 실패는 삭제 요청을 실패시키지 않음")
    void testNotificationFailureIsIsolated() {
        // Given
        doThrow(new IllegalStateException("push down")).when(notificationSink).deletionRequested(any());

        // When
        DeletionRequestResult requested = deletionApprovalService.requestDeletion(orderId, 0, "salah input", 7L);

        // Then
        assertNotNull(requested.getRequestId());
        assertEquals(1, deletionApprovalService.listRequests(DeletionRequestStatus.PENDING).size());
    }
}
