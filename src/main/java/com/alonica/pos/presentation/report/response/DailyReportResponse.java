package com.alonica.pos.presentation.report.response;

import com.alonica.pos.domain.report.DailyReport;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyReportResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    @JsonProperty("report_date")
    private LocalDate reportDate;

    @JsonProperty("total_orders")
    private int totalOrders;

    @JsonProperty("cash_orders")
    private int cashOrders;

    @JsonProperty("non_cash_orders")
    private int nonCashOrders;

    @JsonProperty("total_revenue_cash")
    private long totalRevenueCash;

    @JsonProperty("total_revenue_non_cash")
    private long totalRevenueNonCash;

    @JsonProperty("total_revenue")
    private long totalRevenue;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static DailyReportResponse from(DailyReport report) {
        return DailyReportResponse.builder()
                .reportDate(report.getReportDate())
                .totalOrders(report.getTotalOrders())
                .cashOrders(report.getCashOrders())
                .nonCashOrders(report.getNonCashOrders())
                .totalRevenueCash(report.getTotalRevenueCash())
                .totalRevenueNonCash(report.getTotalRevenueNonCash())
                .totalRevenue(report.getTotalRevenue())
                .updatedAt(report.getUpdatedAt())
                .build();
    }
}
