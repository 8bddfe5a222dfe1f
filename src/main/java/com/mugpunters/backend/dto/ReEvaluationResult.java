package com.mugpunters.backend.dto;

import com.mugpunters.backend.model.PerformanceCategory;
import com.mugpunters.backend.model.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Original analysis next to the freshly computed snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReEvaluationResult {
    private String reportId;
    private String stockSymbol;
    private LocalDateTime originalAnalysisDate;
    private LocalDateTime reEvaluationDate;
    private Double originalPrice;
    private Double currentPrice;
    private Double performancePct;
    private Double predictedReturn;
    private Double actualReturn;
    private Double accuracyScore;
    private String grade;
    private PerformanceCategory category;
    private Integer daysSinceAnalysis;
    private Recommendation originalRecommendation;
    private Double originalConfidence;
    private Double originalTargetPrice;
    private String performanceSummary;
}
