package com.mugpunters.backend.dto;

import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.AnalysisResults;
import com.mugpunters.backend.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportView {
    private String id;
    private String userId;
    private String stockSymbol;
    private RiskLevel riskLevel;
    private String timeframe;
    private Map<String, Object> parameters;
    private AnalysisResults results;
    private LocalDateTime createdAt;
    private LocalDateTime lastUpdated;
    private PerformanceView performance;

    public static ReportView from(AnalysisReport report) {
        return ReportView.builder()
                .id(report.getId())
                .userId(report.getUserId())
                .stockSymbol(report.getStockSymbol())
                .riskLevel(report.getRiskLevel())
                .timeframe(report.getTimeframe())
                .parameters(report.getParameters())
                .results(report.getResults())
                .createdAt(report.getCreatedAt())
                .lastUpdated(report.getLastUpdated())
                .performance(PerformanceView.from(report.getPerformance()))
                .build();
    }
}
