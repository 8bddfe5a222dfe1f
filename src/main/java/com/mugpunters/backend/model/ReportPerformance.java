package com.mugpunters.backend.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Latest performance snapshot of a report. One row per report, overwritten on every
 * re-evaluation. {@code originalPrice} and {@code predictedReturn} are written once.
 * <p>
 * The row written when a report is saved carries the predicted return but no accuracy score:
 * price unchanged, zero return, zero days. Accuracy is only filled in by the first
 * re-evaluation. Until then the snapshot counts in summaries as a 0% neutral entry.
 */
@Entity
@Table(name = "report_performance", indexes = {
        @Index(name = "idx_report_performance_stock_symbol", columnList = "stock_symbol"),
        @Index(name = "idx_report_performance_last_updated", columnList = "last_updated")
})
public class ReportPerformance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "report_id", nullable = false, unique = true)
    private AnalysisReport report;

    @Column(name = "stock_symbol", nullable = false, length = 10)
    private String stockSymbol;

    @Column(name = "original_price", nullable = false, updatable = false)
    private Double originalPrice;

    @Column(name = "current_price", nullable = false)
    private Double currentPrice;

    @Column(name = "performance_pct", nullable = false)
    private Double performancePct;

    @Column(name = "predicted_return", updatable = false)
    private Double predictedReturn;

    // Price change per share since the analysis
    @Column(name = "actual_return", nullable = false)
    private Double actualReturn;

    @Column(name = "accuracy_score")
    private Double accuracyScore;

    @Column(name = "days_since_analysis")
    private Integer daysSinceAnalysis;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "market_conditions", columnDefinition = "TEXT")
    private Map<String, Object> marketConditions;

    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Constructors
    public ReportPerformance() {}

    public ReportPerformance(String stockSymbol, Double originalPrice, Double predictedReturn) {
        this.stockSymbol = stockSymbol;
        this.originalPrice = originalPrice;
        this.currentPrice = originalPrice;
        this.predictedReturn = predictedReturn;
        this.performancePct = 0.0;
        this.actualReturn = 0.0;
        this.daysSinceAnalysis = 0;
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (lastUpdated == null) {
            lastUpdated = createdAt;
        }
    }

    /**
     * Overwrites the re-evaluated fields from {@code source}; the anchor fields stay untouched.
     */
    public void overwriteWith(ReportPerformance source) {
        this.currentPrice = source.getCurrentPrice();
        this.performancePct = source.getPerformancePct();
        this.actualReturn = source.getActualReturn();
        this.accuracyScore = source.getAccuracyScore();
        this.daysSinceAnalysis = source.getDaysSinceAnalysis();
        this.marketConditions = source.getMarketConditions();
        this.lastUpdated = source.getLastUpdated();
    }

    public String getReportId() {
        return report != null ? report.getId() : null;
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public AnalysisReport getReport() { return report; }
    public void setReport(AnalysisReport report) { this.report = report; }

    public String getStockSymbol() { return stockSymbol; }
    public void setStockSymbol(String stockSymbol) { this.stockSymbol = stockSymbol; }

    public Double getOriginalPrice() { return originalPrice; }
    public void setOriginalPrice(Double originalPrice) { this.originalPrice = originalPrice; }

    public Double getCurrentPrice() { return currentPrice; }
    public void setCurrentPrice(Double currentPrice) { this.currentPrice = currentPrice; }

    public Double getPerformancePct() { return performancePct; }
    public void setPerformancePct(Double performancePct) { this.performancePct = performancePct; }

    public Double getPredictedReturn() { return predictedReturn; }
    public void setPredictedReturn(Double predictedReturn) { this.predictedReturn = predictedReturn; }

    public Double getActualReturn() { return actualReturn; }
    public void setActualReturn(Double actualReturn) { this.actualReturn = actualReturn; }

    public Double getAccuracyScore() { return accuracyScore; }
    public void setAccuracyScore(Double accuracyScore) { this.accuracyScore = accuracyScore; }

    public Integer getDaysSinceAnalysis() { return daysSinceAnalysis; }
    public void setDaysSinceAnalysis(Integer daysSinceAnalysis) { this.daysSinceAnalysis = daysSinceAnalysis; }

    public Map<String, Object> getMarketConditions() { return marketConditions; }
    public void setMarketConditions(Map<String, Object> marketConditions) { this.marketConditions = marketConditions; }

    public LocalDateTime getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(LocalDateTime lastUpdated) { this.lastUpdated = lastUpdated; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
