package com.alonica.pos.infrastructure.persistence.report;

import com.alonica.pos.domain.report.DailyReport;
import com.alonica.pos.domain.report.DailyReportRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryDailyReportRepository - 일자별 매출 집계 구현체 (인메모리)
 */
@Repository
public class InMemoryDailyReportRepository implements DailyReportRepository {

    private final ConcurrentHashMap<LocalDate, DailyReport> reports = new ConcurrentHashMap<>();

    @Override
    public DailyReport save(DailyReport report) {
        reports.put(report.getReportDate(), report);
        return report;
    }

    @Override
    public Optional<DailyReport> findByDate(LocalDate reportDate) {
        return Optional.ofNullable(reports.get(reportDate));
    }
}
