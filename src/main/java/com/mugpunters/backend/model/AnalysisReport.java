package com.mugpunters.backend.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A user's saved stock analysis. Never physically deleted by the tracker; see {@link #isActive()}.
 */
@Entity
@Table(name = "analysis_reports", indexes = {
        @Index(name = "idx_analysis_reports_user_id", columnList = "user_id"),
        @Index(name = "idx_analysis_reports_stock_symbol", columnList = "stock_symbol"),
        @Index(name = "idx_analysis_reports_created_at", columnList = "created_at")
})
public class AnalysisReport {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "stock_symbol", nullable = false, length = 10)
    private String stockSymbol;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "parameters", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> parameters;

    @Embedded
    private AnalysisResults results;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 20)
    private RiskLevel riskLevel;

    @Column(name = "timeframe", nullable = false, length = 20)
    private String timeframe = "1y";

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @OneToOne(mappedBy = "report", cascade = CascadeType.ALL, orphanRemoval = true)
    private ReportPerformance performance;

    // Constructors
    public AnalysisReport() {}

    public AnalysisReport(String userId, String stockSymbol, RiskLevel riskLevel, String timeframe) {
        this.userId = userId;
        this.stockSymbol = stockSymbol;
        this.riskLevel = riskLevel;
        this.timeframe = timeframe;
    }

    @PrePersist
    void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (lastUpdated == null || lastUpdated.isBefore(createdAt)) {
            lastUpdated = createdAt;
        }
    }

    public void attachPerformance(ReportPerformance performance) {
        this.performance = performance;
        if (performance != null) {
            performance.setReport(this);
        }
    }

    public Recommendation getRecommendation() {
        return results != null ? results.getRecommendation() : null;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getStockSymbol() { return stockSymbol; }
    public void setStockSymbol(String stockSymbol) { this.stockSymbol = stockSymbol; }

    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }

    public AnalysisResults getResults() { return results; }
    public void setResults(AnalysisResults results) { this.results = results; }

    public RiskLevel getRiskLevel() { return riskLevel; }
    public void setRiskLevel(RiskLevel riskLevel) { this.riskLevel = riskLevel; }

    public String getTimeframe() { return timeframe; }
    public void setTimeframe(String timeframe) { this.timeframe = timeframe; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(LocalDateTime lastUpdated) { this.lastUpdated = lastUpdated; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public ReportPerformance getPerformance() { return performance; }
    public void setPerformance(ReportPerformance performance) { this.performance = performance; }
}
