package com.alonica.pos.application.report;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.PaymentStatus;
import com.alonica.pos.domain.report.DailyReport;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import com.alonica.pos.infrastructure.persistence.report.InMemoryDailyReportRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DailyReportService 테스트")
class DailyReportServiceTest {

    private InMemoryOrderRepository orderRepository;
    private DailyReportService dailyReportService;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        dailyReportService = new DailyReportService(orderRepository, new InMemoryDailyReportRepository());
    }

    private static List<OrderItem> items(long price) {
        return List.of(OrderItem.createOrderItem(1L, "Es Teh", price, 1, null));
    }

    private void paidQrisOrder(long price) {
        Order order = orderRepository.save(Order.createQrisOrder("Sari", "B2", items(price), 0L));
        order.applyGatewayPaymentStatus(PaymentStatus.PAID, "settlement", LocalDateTime.now());
        orderRepository.save(order);
    }

    @Test
    @DisplayName("현금/비현금 매출을 분리하여 집계하고 미결제 주문은 제외")
    void testRecount_SplitsCashAndNonCash() {
        // Given
        orderRepository.save(Order.createCashOrder("Budi", "A1", items(30000L), 0L));
        orderRepository.save(Order.createCashOrder("Ani", "A2", items(20000L), 0L));
        paidQrisOrder(15000L);
        orderRepository.save(Order.createQrisOrder("Dewi", "A3", items(99000L), 0L));

        // When
        DailyReport report = dailyReportService.recount(LocalDate.now());

        // Then
        assertEquals(3, report.getTotalOrders());
        assertEquals(2, report.getCashOrders());
        assertEquals(1, report.getNonCashOrders());
        assertEquals(50000L, report.getTotalRevenueCash());
        assertEquals(15000L, report.getTotalRevenueNonCash());
        assertEquals(65000L, report.getTotalRevenue());
    }

    @Test
    @DisplayName("같은 일자를 여러 번 재집계해도 매출이 중복되지 않음")
    void testRecount_Idempotent() {
        // Given
        orderRepository.save(Order.createCashOrder("Budi", "A1", items(30000L), 0L));

        // When
        dailyReportService.recount(LocalDate.now());
        DailyReport report = dailyReportService.recount(LocalDate.now());

        // Then
        assertEquals(1, report.getTotalOrders());
        assertEquals(30000L, report.getTotalRevenue());
    }

    @Test
    @DisplayName("저장된 집계가 없으면 조회 시 즉시 계산, 다른 일자는 0")
    void testGetDaily() {
        // Given
        orderRepository.save(Order.createCashOrder("Budi", "A1", items(30000L), 0L));

        // When
        DailyReport today = dailyReportService.getDaily(LocalDate.now());
        DailyReport lastYear = dailyReportService.getDaily(LocalDate.now().minusYears(1));

        // Then
        assertEquals(30000L, today.getTotalRevenue());
        assertEquals(0, lastYear.getTotalOrders());
        assertEquals(0L, lastYear.getTotalRevenue());
    }
}
