package com.alonica.pos.application.hook;

import com.alonica.pos.application.report.DailyReportService;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 결제 완료 시 해당 일자의 매출 집계 재계산
 */
@Component
public class RevenueRecountHook implements PostCommitHook<OrderPaidEvent> {

    private final DailyReportService dailyReportService;

    public RevenueRecountHook(DailyReportService dailyReportService) {
        this.dailyReportService = dailyReportService;
    }

    @Override
    public String getName() {
        return "revenueRecount";
    }

    @Override
    public Class<OrderPaidEvent> getEventType() {
        return OrderPaidEvent.class;
    }

    @Override
    public Optional<String> handle(OrderPaidEvent event) {
        LocalDateTime paidAt = event.getPaidAt() != null ? event.getPaidAt() : LocalDateTime.now();
        dailyReportService.recount(paidAt.toLocalDate());
        return Optional.empty();
    }
}
