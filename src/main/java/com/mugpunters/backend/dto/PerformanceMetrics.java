package com.mugpunters.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mugpunters.backend.model.PerformanceCategory;
import com.mugpunters.backend.model.Recommendation;
import com.mugpunters.backend.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Detailed view of a report's stored performance snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {
    private String reportId;
    private String stockSymbol;
    private LocalDateTime analysisDate;
    private LocalDateTime lastUpdated;
    private PriceMovement priceMovement;
    private ReturnAnalysis returnAnalysis;
    private TimeAnalysis timeAnalysis;
    private RecommendationAssessment recommendationAccuracy;
    private String performanceGrade;
    private PerformanceCategory performanceCategory;
    // Left out when the benchmark could not be resolved
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BenchmarkComparison benchmarkComparison;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PriceMovement {
        private Double originalPrice;
        private Double currentPrice;
        private Double priceChange;
        private Double priceChangePct;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReturnAnalysis {
        private Double predictedReturn;
        private Double actualReturn;
        private Double returnDifference;
        private Double accuracyScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeAnalysis {
        private Integer daysSinceAnalysis;
        private String analysisTimeframe;
        private RiskLevel riskLevel;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecommendationAssessment {
        private Recommendation recommendation;
        private boolean wasCorrect;
        private Double performance;
        private Double confidence;
    }
}
