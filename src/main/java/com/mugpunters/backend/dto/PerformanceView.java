package com.mugpunters.backend.dto;

import com.mugpunters.backend.model.ReportPerformance;
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
public class PerformanceView {
    private String reportId;
    private String stockSymbol;
    private Double originalPrice;
    private Double currentPrice;
    private Double performancePct;
    private Double predictedReturn;
    private Double actualReturn;
    private Double accuracyScore;
    private Integer daysSinceAnalysis;
    private Map<String, Object> marketConditions;
    private LocalDateTime lastUpdated;

    public static PerformanceView from(ReportPerformance performance) {
        if (performance == null) {
            return null;
        }
        return PerformanceView.builder()
                .reportId(performance.getReportId())
                .stockSymbol(performance.getStockSymbol())
                .originalPrice(performance.getOriginalPrice())
                .currentPrice(performance.getCurrentPrice())
                .performancePct(performance.getPerformancePct())
                .predictedReturn(performance.getPredictedReturn())
                .actualReturn(performance.getActualReturn())
                .accuracyScore(performance.getAccuracyScore())
                .daysSinceAnalysis(performance.getDaysSinceAnalysis())
                .marketConditions(performance.getMarketConditions())
                .lastUpdated(performance.getLastUpdated())
                .build();
    }
}
