package com.alonica.pos.infrastructure.persistence.report;

import com.alonica.pos.domain.report.DailyReport;
import com.alonica.pos.domain.report.DailyReportRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

/**
 * MySQL 기반 일자별 매출 집계 Repository 구현
 * reportDate가 PK이므로 save는 upsert로 동작한다 (merge).
 */
@Repository
public class MySQLDailyReportRepository implements DailyReportRepository {

    private final DailyReportJpaRepository dailyReportJpaRepository;

    public MySQLDailyReportRepository(DailyReportJpaRepository dailyReportJpaRepository) {
        this.dailyReportJpaRepository = dailyReportJpaRepository;
    }

    @Override
    public DailyReport save(DailyReport report) {
        return dailyReportJpaRepository.save(report);
    }

    @Override
    public Optional<DailyReport> findByDate(LocalDate reportDate) {
        return dailyReportJpaRepository.findById(reportDate);
    }
}
