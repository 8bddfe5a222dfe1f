package com.mugpunters.backend.service;

import com.mugpunters.backend.config.ReportTrackingProperties;
import com.mugpunters.backend.dto.BenchmarkComparison;
import com.mugpunters.backend.dto.PerformanceMetrics;
import com.mugpunters.backend.dto.PerformanceSummary;
import com.mugpunters.backend.dto.ReEvaluationResult;
import com.mugpunters.backend.dto.ReportFilter;
import com.mugpunters.backend.exception.InvalidInputException;
import com.mugpunters.backend.exception.PriceUnavailableException;
import com.mugpunters.backend.exception.ReportNotFoundException;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.AnalysisResults;
import com.mugpunters.backend.model.PerformanceGrade;
import com.mugpunters.backend.model.Recommendation;
import com.mugpunters.backend.model.ReportPerformance;
import com.mugpunters.backend.service.market.BenchmarkReturn;
import com.mugpunters.backend.service.market.BenchmarkSource;
import com.mugpunters.backend.service.market.PriceQuote;
import com.mugpunters.backend.service.market.PriceSource;
import com.mugpunters.backend.service.store.ReportStore;
import com.mugpunters.backend.service.util.PerformanceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Re-evaluates saved reports against the market and reports on their accuracy.
 * <p>
 * The price lookup happens before anything is written; if it fails the stored snapshot is left
 * exactly as it was, so callers may simply retry.
 */
@Service
public class ReportEvaluationService {

    private static final Logger logger = LoggerFactory.getLogger(ReportEvaluationService.class);

    private final ReportStore reportStore;
    private final PriceSource priceSource;
    private final BenchmarkSource benchmarkSource;
    private final ReportTrackingProperties properties;
    private final Clock clock;
    private final PerformanceSummaryAggregator summaryAggregator;

    public ReportEvaluationService(ReportStore reportStore,
                                   PriceSource priceSource,
                                   BenchmarkSource benchmarkSource,
                                   ReportTrackingProperties properties,
                                   Clock clock) {
        this.reportStore = reportStore;
        this.priceSource = priceSource;
        this.benchmarkSource = benchmarkSource;
        this.properties = properties;
        this.clock = clock;
        this.summaryAggregator = new PerformanceSummaryAggregator(holdBand());
    }

    public ReEvaluationResult reEvaluate(String reportId) {
        AnalysisReport report = loadActive(reportId);
        ReportPerformance existing = report.getPerformance();

        double originalPrice = resolveOriginalPrice(report, existing);
        Double predictedReturn = existing != null
                ? existing.getPredictedReturn()
                : predictedReturnFor(report.getResults(), originalPrice);

        PriceQuote quote = fetchQuote(report.getStockSymbol());
        LocalDateTime now = LocalDateTime.now(clock);

        ReportPerformance evaluated = evaluate(report, originalPrice, predictedReturn, quote, now);
        ReportPerformance saved = reportStore.saveEvaluation(reportId, evaluated);

        PerformanceGrade grade = PerformanceCalculator.grade(saved.getAccuracyScore());
        AnalysisResults results = report.getResults();

        logger.info("Re-evaluated report {} - Performance: {}%", reportId,
                String.format(Locale.ROOT, "%.2f", saved.getPerformancePct()));

        return ReEvaluationResult.builder()
                .reportId(report.getId())
                .stockSymbol(report.getStockSymbol())
                .originalAnalysisDate(report.getCreatedAt())
                .reEvaluationDate(now)
                .originalPrice(saved.getOriginalPrice())
                .currentPrice(saved.getCurrentPrice())
                .performancePct(saved.getPerformancePct())
                .predictedReturn(saved.getPredictedReturn())
                .actualReturn(saved.getActualReturn())
                .accuracyScore(saved.getAccuracyScore())
                .grade(PerformanceGrade.label(grade))
                .category(PerformanceCalculator.category(saved.getPerformancePct()))
                .daysSinceAnalysis(saved.getDaysSinceAnalysis())
                .originalRecommendation(results != null ? results.getRecommendation() : null)
                .originalConfidence(results != null ? results.getConfidence() : null)
                .originalTargetPrice(results != null ? results.getTargetPrice() : null)
                .performanceSummary(describe(report.getStockSymbol(), saved.getPerformancePct(),
                        saved.getPredictedReturn(), saved.getAccuracyScore(), grade))
                .build();
    }

    public PerformanceMetrics getPerformance(String reportId) {
        AnalysisReport report = loadActive(reportId);
        ReportPerformance performance = report.getPerformance();
        if (performance == null) {
            throw new ReportNotFoundException(reportId, "Report " + reportId + " has no performance snapshot yet");
        }

        double pct = performance.getPerformancePct();
        Double predicted = performance.getPredictedReturn();
        AnalysisResults results = report.getResults();
        Recommendation recommendation = report.getRecommendation();

        return PerformanceMetrics.builder()
                .reportId(report.getId())
                .stockSymbol(report.getStockSymbol())
                .analysisDate(report.getCreatedAt())
                .lastUpdated(performance.getLastUpdated())
                .priceMovement(PerformanceMetrics.PriceMovement.builder()
                        .originalPrice(performance.getOriginalPrice())
                        .currentPrice(performance.getCurrentPrice())
                        .priceChange(performance.getCurrentPrice() - performance.getOriginalPrice())
                        .priceChangePct(pct)
                        .build())
                .returnAnalysis(PerformanceMetrics.ReturnAnalysis.builder()
                        .predictedReturn(predicted)
                        .actualReturn(pct)
                        .returnDifference(predicted != null ? pct - predicted : null)
                        .accuracyScore(performance.getAccuracyScore())
                        .build())
                .timeAnalysis(PerformanceMetrics.TimeAnalysis.builder()
                        .daysSinceAnalysis(performance.getDaysSinceAnalysis())
                        .analysisTimeframe(report.getTimeframe())
                        .riskLevel(report.getRiskLevel())
                        .build())
                .recommendationAccuracy(PerformanceMetrics.RecommendationAssessment.builder()
                        .recommendation(recommendation)
                        .wasCorrect(PerformanceCalculator.recommendationCorrect(recommendation, pct, holdBand()))
                        .performance(pct)
                        .confidence(results != null ? results.getConfidence() : null)
                        .build())
                .performanceGrade(PerformanceGrade.label(PerformanceCalculator.grade(performance.getAccuracyScore())))
                .performanceCategory(PerformanceCalculator.category(pct))
                .benchmarkComparison(compareWithBenchmark(report, pct))
                .build();
    }

    public PerformanceSummary getSummary(String userId) {
        List<AnalysisReport> reports = reportStore.loadAll(userId, ReportFilter.none());
        PerformanceSummary summary = summaryAggregator.summarize(reports);
        logger.debug("Summarised {} reports for user {}", summary.getTotalReports(), userId);
        return summary;
    }

    private AnalysisReport loadActive(String reportId) {
        return reportStore.load(reportId)
                .filter(AnalysisReport::isActive)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    private double resolveOriginalPrice(AnalysisReport report, ReportPerformance existing) {
        if (existing != null && existing.getOriginalPrice() != null && existing.getOriginalPrice() > 0) {
            return existing.getOriginalPrice();
        }
        // No snapshot yet: fall back to the price captured when the report was saved
        AnalysisResults results = report.getResults();
        if (results != null && results.getCurrentPrice() != null && results.getCurrentPrice() > 0) {
            return results.getCurrentPrice();
        }
        throw new InvalidInputException("Report " + report.getId() + " has no original price to measure against");
    }

    static Double predictedReturnFor(AnalysisResults results, double originalPrice) {
        if (results == null || results.getTargetPrice() == null) {
            return null;
        }
        return PerformanceCalculator.predictedReturnPct(results.getTargetPrice(), originalPrice);
    }

    private PriceQuote fetchQuote(String symbol) {
        PriceQuote quote;
        try {
            quote = priceSource.getCurrentPrice(symbol, priceTimeout());
        } catch (PriceUnavailableException e) {
            logger.warn("Price unavailable for {}: {}", symbol, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Price source {} failed for {}: {}", priceSource.getSourceName(), symbol, e.getMessage());
            throw new PriceUnavailableException(symbol, "Price source failed: " + e.getMessage(), e);
        }
        if (quote == null || !(quote.getPrice() > 0)) {
            throw new PriceUnavailableException(symbol, "Price source returned no usable price");
        }
        return quote;
    }

    private ReportPerformance evaluate(AnalysisReport report, double originalPrice, Double predictedReturn,
                                       PriceQuote quote, LocalDateTime now) {
        double currentPrice = quote.getPrice();
        double pct = PerformanceCalculator.actualReturnPct(originalPrice, currentPrice);

        ReportPerformance evaluated = new ReportPerformance(report.getStockSymbol(), originalPrice, predictedReturn);
        evaluated.setCurrentPrice(currentPrice);
        evaluated.setPerformancePct(pct);
        evaluated.setActualReturn(currentPrice - originalPrice);
        evaluated.setAccuracyScore(PerformanceCalculator.accuracyScore(pct, predictedReturn));
        evaluated.setDaysSinceAnalysis(PerformanceCalculator.daysSinceAnalysis(report.getCreatedAt(), now));
        evaluated.setLastUpdated(now);

        Map<String, Object> marketConditions = new LinkedHashMap<>();
        marketConditions.put("priceSource", priceSource.getSourceName());
        marketConditions.put("quotedAt", quote.getTimestamp() != null ? quote.getTimestamp().toString() : null);
        evaluated.setMarketConditions(marketConditions);

        logger.debug("Report {}: {} -> {} ({}%), predicted {}%, accuracy {}", report.getId(),
                originalPrice, currentPrice, pct, predictedReturn, evaluated.getAccuracyScore());
        return evaluated;
    }

    private BenchmarkComparison compareWithBenchmark(AnalysisReport report, double pct) {
        try {
            BenchmarkReturn benchmark = benchmarkSource.getReturnSince(report.getCreatedAt(), priceTimeout());
            return BenchmarkComparison.builder()
                    .benchmarkName(benchmark.getBenchmarkName())
                    .benchmarkPerformance(benchmark.getReturnPct())
                    .outperformance(PerformanceCalculator.outperformance(pct, benchmark.getReturnPct()))
                    .build();
        } catch (PriceUnavailableException e) {
            logger.warn("Benchmark {} unavailable for report {}: {}",
                    benchmarkSource.getBenchmarkName(), report.getId(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            logger.warn("Benchmark {} failed for report {}", benchmarkSource.getBenchmarkName(), report.getId(), e);
            return null;
        }
    }

    /**
     * One-line summary such as "CBA is up 4.29% vs a predicted 7.91%, giving 54% accuracy (grade D)".
     */
    static String describe(String symbol, double pct, Double predicted, Double accuracy, PerformanceGrade grade) {
        String movement;
        if (pct > 0) {
            movement = String.format(Locale.ROOT, "is up %.2f%%", pct);
        } else if (pct < 0) {
            movement = String.format(Locale.ROOT, "is down %.2f%%", Math.abs(pct));
        } else {
            movement = "is unchanged";
        }
        if (predicted == null) {
            return symbol + " " + movement + " with no predicted return (not yet gradable)";
        }
        String prediction = String.format(Locale.ROOT, " vs a predicted %.2f%%", predicted);
        if (accuracy == null) {
            return symbol + " " + movement + prediction + " (not yet gradable)";
        }
        return symbol + " " + movement + prediction
                + String.format(Locale.ROOT, ", giving %.0f%% accuracy (grade %s)", accuracy * 100, PerformanceGrade.label(grade));
    }

    private double holdBand() {
        return properties.getEvaluation().getHoldNeutralityBandPct();
    }

    private Duration priceTimeout() {
        return properties.getEvaluation().getPriceTimeout();
    }
}
