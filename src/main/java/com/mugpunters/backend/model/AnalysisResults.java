package com.mugpunters.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of the original analysis as produced upstream. Scores are 0-100, confidence 0-1.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResults {

    @Column(name = "technical_score")
    private Double technicalScore;

    @Column(name = "fundamental_score")
    private Double fundamentalScore;

    @Column(name = "risk_score")
    private Double riskScore;

    @Column(name = "overall_score")
    private Double overallScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "recommendation", nullable = false, length = 20)
    private Recommendation recommendation;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "target_price")
    private Double targetPrice;

    // Market price when the analysis was made; becomes the performance anchor
    @Column(name = "analysis_price")
    private Double currentPrice;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "key_metrics", columnDefinition = "TEXT")
    private Map<String, Object> keyMetrics;
}
