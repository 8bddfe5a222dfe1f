package com.mugpunters.backend.controller;

import com.mugpunters.backend.dto.CreateReportRequest;
import com.mugpunters.backend.dto.PerformanceMetrics;
import com.mugpunters.backend.dto.PerformanceSummary;
import com.mugpunters.backend.dto.ReEvaluationResult;
import com.mugpunters.backend.dto.ReportFilter;
import com.mugpunters.backend.dto.ReportView;
import com.mugpunters.backend.model.RiskLevel;
import com.mugpunters.backend.service.ReportEvaluationService;
import com.mugpunters.backend.service.ReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Saved analysis reports and their performance tracking. The caller is identified by the
 * {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/reports")
@CrossOrigin(origins = "http://localhost:3000", allowCredentials = "true")
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    static final String USER_HEADER = "X-User-Id";

    private final ReportService reportService;
    private final ReportEvaluationService evaluationService;

    public ReportController(ReportService reportService, ReportEvaluationService evaluationService) {
        this.reportService = reportService;
        this.evaluationService = evaluationService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listReports(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) String riskLevel,
            @RequestParam(required = false) String timeframe,
            @RequestParam(required = false) String stockSymbol,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "100") int limit) {
        logger.info("Listing reports for user {} (riskLevel={}, timeframe={}, symbol={})",
                userId, riskLevel, timeframe, stockSymbol);

        ReportFilter filter = ReportFilter.builder()
                .riskLevel(riskLevel != null && !riskLevel.isBlank() ? RiskLevel.fromValue(riskLevel) : null)
                .timeframe(timeframe)
                .stockSymbol(stockSymbol)
                .skip(skip)
                .limit(limit)
                .build();
        List<ReportView> reports = reportService.listReports(userId, filter);

        Map<String, Object> response = success(reports);
        response.put("totalReports", reports.size());
        return ResponseEntity.ok(response);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createReport(
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody CreateReportRequest request) {
        logger.info("Saving report for user {}", userId);
        ReportView report = reportService.createReport(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(success(report));
    }

    @GetMapping("/{reportId}")
    public ResponseEntity<Map<String, Object>> getReport(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String reportId) {
        return ResponseEntity.ok(success(reportService.getReport(userId, reportId)));
    }

    @DeleteMapping("/{reportId}")
    public ResponseEntity<Map<String, Object>> deleteReport(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String reportId) {
        reportService.deactivateReport(userId, reportId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Report deleted successfully");
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{reportId}/re-evaluate")
    public ResponseEntity<Map<String, Object>> reEvaluate(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String reportId) {
        logger.info("Re-evaluating report {} for user {}", reportId, userId);
        reportService.requireOwnedReport(userId, reportId);
        ReEvaluationResult result = evaluationService.reEvaluate(reportId);
        return ResponseEntity.ok(success(result));
    }

    @GetMapping("/{reportId}/performance")
    public ResponseEntity<Map<String, Object>> getPerformance(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String reportId) {
        reportService.requireOwnedReport(userId, reportId);
        PerformanceMetrics metrics = evaluationService.getPerformance(reportId);
        return ResponseEntity.ok(success(metrics));
    }

    @GetMapping("/performance/summary")
    public ResponseEntity<Map<String, Object>> getPerformanceSummary(
            @RequestHeader(USER_HEADER) String userId) {
        logger.info("Building performance summary for user {}", userId);
        PerformanceSummary summary = evaluationService.getSummary(userId);
        return ResponseEntity.ok(success(summary));
    }

    private static Map<String, Object> success(Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", data);
        return response;
    }
}
