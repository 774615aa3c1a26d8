package com.alonica.pos.application.report;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.report.DailyReport;
import com.alonica.pos.domain.report.DailyReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * DailyReportService - 일자별 매출 집계
 *
 * 결제 완료 훅(RevenueRecountHook)이 호출할 때마다 해당 일자의 결제 완료 주문 전체로 다시 계산한다.
 * 재집계 방식이므로 같은 결제가 여러 번 통지되어도 매출이 중복되지 않는다.
 */
@Service
public class DailyReportService {

    private static final Logger log = LoggerFactory.getLogger(DailyReportService.class);

    private final OrderRepository orderRepository;
    private final DailyReportRepository dailyReportRepository;

    public DailyReportService(OrderRepository orderRepository, DailyReportRepository dailyReportRepository) {
        this.orderRepository = orderRepository;
        this.dailyReportRepository = dailyReportRepository;
    }

    public DailyReport recount(LocalDate date) {
        List<Order> paidOrders = orderRepository.findPaidBetween(date.atStartOfDay(), date.atTime(LocalTime.MAX));
        DailyReport report = dailyReportRepository.save(DailyReport.recount(date, paidOrders));
        log.info("[DailyReportService] 일자 매출 재집계 - date={}, totalOrders={}, totalRevenue={}",
                date, report.getTotalOrders(), report.getTotalRevenue());
        return report;
    }

    /**
     * 일자 집계 조회 (저장된 집계가 없으면 즉시 계산)
     */
    public DailyReport getDaily(LocalDate date) {
        return dailyReportRepository.findByDate(date)
                .orElseGet(() -> recount(date));
    }
}
