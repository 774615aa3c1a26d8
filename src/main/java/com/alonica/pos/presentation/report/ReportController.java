package com.alonica.pos.presentation.report;

import com.alonica.pos.application.report.DailyReportService;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.report.response.DailyReportResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/reports")
public class ReportController {

    private final DailyReportService dailyReportService;

    public ReportController(DailyReportService dailyReportService) {
        this.dailyReportService = dailyReportService;
    }

    /**
     * 일별 매출 (GET /api/reports/daily/{date}), date: yyyy-MM-dd
     */
    @GetMapping("/daily/{date}")
    @RequiresCapability(Capability.VIEW_REPORTS)
    public ResponseEntity<DailyReportResponse> getDaily(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(DailyReportResponse.from(dailyReportService.getDaily(date)));
    }
}
