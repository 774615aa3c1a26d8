package com.alonica.pos.infrastructure.persistence.report;

import com.alonica.pos.domain.report.DailyReport;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;

/**
 * DailyReport JPA Repository
 */
public interface DailyReportJpaRepository extends JpaRepository<DailyReport, LocalDate> {
}
