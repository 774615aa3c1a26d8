package com.alonica.pos.domain.report;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 일자별 매출 집계 영속성 Port
 */
public interface DailyReportRepository {

    DailyReport save(DailyReport report);

    Optional<DailyReport> findByDate(LocalDate reportDate);
}
