package com.alonica.pos.domain.report;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.PaymentMethod;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * DailyReport - 일자별 매출 집계
 *
 * 결제 완료 훅이 해당 일자의 결제 완료 주문 전체로 다시 계산한다 (증분 누적이 아닌 재집계).
 */
@Entity
@Table(name = "daily_reports")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DailyReport {

    @Id
    @Column(name = "report_date")
    private LocalDate reportDate;

    @Column(name = "total_orders", nullable = false)
    private int totalOrders;

    @Column(name = "cash_orders", nullable = false)
    private int cashOrders;

    @Column(name = "non_cash_orders", nullable = false)
    private int nonCashOrders;

    @Column(name = "total_revenue_cash", nullable = false)
    private long totalRevenueCash;

    @Column(name = "total_revenue_non_cash", nullable = false)
    private long totalRevenueNonCash;

    @Column(name = "total_revenue", nullable = false)
    private long totalRevenue;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 결제 완료 주문 목록으로 일자 집계 생성
     */
    public static DailyReport recount(LocalDate reportDate, List<Order> paidOrders) {
        int cashOrders = 0;
        int nonCashOrders = 0;
        long cashRevenue = 0L;
        long nonCashRevenue = 0L;
        for (Order order : paidOrders) {
            if (order.getPaymentMethod() == PaymentMethod.CASH) {
                cashOrders++;
                cashRevenue += order.getTotal();
            } else {
                nonCashOrders++;
                nonCashRevenue += order.getTotal();
            }
        }
        return DailyReport.builder()
                .reportDate(reportDate)
                .totalOrders(cashOrders + nonCashOrders)
                .cashOrders(cashOrders)
                .nonCashOrders(nonCashOrders)
                .totalRevenueCash(cashRevenue)
                .totalRevenueNonCash(nonCashRevenue)
                .totalRevenue(cashRevenue + nonCashRevenue)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
