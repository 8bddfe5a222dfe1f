package com.mugpunters.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time aggregate over a user's reports. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSummary {
    private int totalReports;
    private int reportsWithPerformance;
    private Double averageAccuracy;
    private double totalPerformance;
    private PerformerSnapshot bestPerformer;
    private PerformerSnapshot worstPerformer;
    // Keyed by recommendation value, e.g. "strong_buy"
    private Map<String, RecommendationStats> recommendationAccuracy;
    // Keyed by category value; all five categories always present
    private Map<String, Integer> performanceDistribution;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PerformerSnapshot {
        private String reportId;
        private String symbol;
        private Double performance;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecommendationStats {
        private int total;
        private int positive;
        private double accuracy;
    }
}
