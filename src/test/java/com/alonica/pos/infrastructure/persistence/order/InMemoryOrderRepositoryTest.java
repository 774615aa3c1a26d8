package com.alonica.pos.infrastructure.persistence.order;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.PaymentMethod;
import com.alonica.pos.domain.order.PaymentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryOrderRepository 테스트")
class InMemoryOrderRepositoryTest {

    private InMemoryOrderRepository orderRepository;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
    }

    private static List<OrderItem> items() {
        return List.of(OrderItem.createOrderItem(1L, "Es Teh", 5000L, 1, null));
    }

    @Test
    @DisplayName("결제 상태 compare-and-set 동시 호출 - 정확히 한 번만 성공")
    void testCompareAndSet_Concurrent() throws InterruptedException {
        // Given
        Order order = orderRepository.save(Order.createQrisOrder("Budi", null, items(), 0L));
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger applied = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    ready.await();
                    if (orderRepository.compareAndSetPaymentStatus(order.getOrderId(), PaymentStatus.PENDING,
                            PaymentStatus.PAID, "settlement", LocalDateTime.now())) {
                        applied.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.countDown();
        done.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertEquals(1, applied.get());
        assertEquals(PaymentStatus.PAID, orderRepository.findById(order.getOrderId()).orElseThrow().getPaymentStatus());
    }

    @Test
    @DisplayName("테이블의 최신 오픈 빌 조회 - 결제된 오픈 빌은 제외")
    void testFindLatestOpenBillByTable() {
        // Given
        Order paid = Order.createOpenBill("Sari", "B2", items(), PaymentMethod.CASH);
        paid.payOpenBill(PaymentMethod.CASH);
        orderRepository.save(paid);
        Order open = orderRepository.save(Order.createOpenBill("Sari", "B2", items(), PaymentMethod.CASH));
        orderRepository.save(Order.createOpenBill("Dewi", "C3", items(), PaymentMethod.CASH));

        // When & Then
        assertEquals(open.getOrderId(),
                orderRepository.findLatestOpenBillByTable("B2").orElseThrow().getOrderId());
        assertTrue(orderRepository.findLatestOpenBillByTable("Z9").isEmpty());
        assertEquals(2, orderRepository.findOpenBills().size());
    }

    @Test
    @DisplayName("게이트웨이 주문 ID로 조회")
    void testFindByGatewayOrderId() {
        // Given
        Order order = Order.createQrisOrder("Budi", null, items(), 0L);
        order.attachGatewayCharge("ALONICA-77", "trx", "pending", null, null, null, false);
        Order saved = orderRepository.save(order);

        // When & Then
        assertEquals(saved.getOrderId(), orderRepository.findByGatewayOrderId("ALONICA-77").orElseThrow().getOrderId());
        assertTrue(orderRepository.findByGatewayOrderId("ALONICA-78").isEmpty());
    }
}
