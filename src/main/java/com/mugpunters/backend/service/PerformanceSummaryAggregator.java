package com.mugpunters.backend.service;

import com.mugpunters.backend.dto.PerformanceSummary;
import com.mugpunters.backend.dto.PerformanceSummary.PerformerSnapshot;
import com.mugpunters.backend.dto.PerformanceSummary.RecommendationStats;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.PerformanceCategory;
import com.mugpunters.backend.model.Recommendation;
import com.mugpunters.backend.model.ReportPerformance;
import com.mugpunters.backend.service.util.PerformanceCalculator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Portfolio-level statistics over a set of reports with their performance snapshots.
 * Reports without a snapshot count towards the total only; reports without an accuracy
 * score are left out of the average rather than counted as zero. A snapshot that has not been
 * re-evaluated yet still counts with its 0% return.
 */
public class PerformanceSummaryAggregator {

    private final double holdNeutralityBandPct;

    public PerformanceSummaryAggregator(double holdNeutralityBandPct) {
        this.holdNeutralityBandPct = holdNeutralityBandPct;
    }

    public PerformanceSummary summarize(Collection<AnalysisReport> reports) {
        DescriptiveStatistics accuracyStats = new DescriptiveStatistics();
        Map<PerformanceCategory, Integer> distribution = new EnumMap<>(PerformanceCategory.class);
        for (PerformanceCategory category : PerformanceCategory.values()) {
            distribution.put(category, 0);
        }
        Map<Recommendation, RecommendationStats> byRecommendation = new EnumMap<>(Recommendation.class);

        int totalReports = 0;
        int withPerformance = 0;
        double totalPerformance = 0.0;
        PerformerSnapshot best = null;
        PerformerSnapshot worst = null;

        if (reports != null) {
            for (AnalysisReport report : reports) {
                totalReports++;
                ReportPerformance performance = report.getPerformance();
                if (performance == null || performance.getPerformancePct() == null) {
                    continue;
                }
                withPerformance++;
                double pct = performance.getPerformancePct();
                totalPerformance += pct;

                if (performance.getAccuracyScore() != null) {
                    accuracyStats.addValue(performance.getAccuracyScore());
                }

                if (best == null || pct > best.getPerformance()) {
                    best = snapshot(report, pct);
                }
                if (worst == null || pct < worst.getPerformance()) {
                    worst = snapshot(report, pct);
                }

                distribution.merge(PerformanceCalculator.category(pct), 1, Integer::sum);

                Recommendation recommendation = report.getRecommendation();
                if (recommendation != null) {
                    RecommendationStats stats = byRecommendation.computeIfAbsent(
                            recommendation, r -> new RecommendationStats());
                    stats.setTotal(stats.getTotal() + 1);
                    if (PerformanceCalculator.recommendationCorrect(recommendation, pct, holdNeutralityBandPct)) {
                        stats.setPositive(stats.getPositive() + 1);
                    }
                }
            }
        }

        Map<String, RecommendationStats> recommendationAccuracy = new LinkedHashMap<>();
        byRecommendation.forEach((recommendation, stats) -> {
            stats.setAccuracy(stats.getTotal() > 0 ? (double) stats.getPositive() / stats.getTotal() : 0.0);
            recommendationAccuracy.put(recommendation.getValue(), stats);
        });

        Map<String, Integer> performanceDistribution = new LinkedHashMap<>();
        distribution.forEach((category, count) -> performanceDistribution.put(category.getValue(), count));

        return PerformanceSummary.builder()
                .totalReports(totalReports)
                .reportsWithPerformance(withPerformance)
                .averageAccuracy(accuracyStats.getN() > 0 ? accuracyStats.getMean() : null)
                .totalPerformance(totalPerformance)
                .bestPerformer(best)
                .worstPerformer(worst)
                .recommendationAccuracy(recommendationAccuracy)
                .performanceDistribution(performanceDistribution)
                .build();
    }

    private static PerformerSnapshot snapshot(AnalysisReport report, double pct) {
        return PerformerSnapshot.builder()
                .reportId(report.getId())
                .symbol(report.getStockSymbol())
                .performance(pct)
                .build();
    }
}
