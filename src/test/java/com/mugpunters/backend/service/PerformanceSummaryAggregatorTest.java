package com.mugpunters.backend.service;

import com.mugpunters.backend.dto.PerformanceSummary;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.AnalysisResults;
import com.mugpunters.backend.model.Recommendation;
import com.mugpunters.backend.model.ReportPerformance;
import com.mugpunters.backend.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PerformanceSummaryAggregatorTest {

    private final PerformanceSummaryAggregator aggregator = new PerformanceSummaryAggregator(2.0);

    @Test
    void summarize_withNoReports_shouldReturnEmptySummary() {
        PerformanceSummary summary = aggregator.summarize(Collections.emptyList());

        assertEquals(0, summary.getTotalReports());
        assertEquals(0, summary.getReportsWithPerformance());
        assertNull(summary.getAverageAccuracy());
        assertEquals(0.0, summary.getTotalPerformance(), 0.0);
        assertNull(summary.getBestPerformer());
        assertNull(summary.getWorstPerformer());
        assertTrue(summary.getRecommendationAccuracy().isEmpty());
        assertEquals(5, summary.getPerformanceDistribution().size());
        summary.getPerformanceDistribution().values().forEach(count -> assertEquals(0, count));
    }

    @Test
    void summarize_withNull_shouldNotThrow() {
        PerformanceSummary summary = aggregator.summarize(null);
        assertEquals(0, summary.getTotalReports());
    }

    @Test
    void summarize_shouldAggregateAcrossReports() {
        List<AnalysisReport> reports = Arrays.asList(
                report("r1", "CBA", Recommendation.BUY, 4.29, 0.54),
                report("r2", "BHP", Recommendation.SELL, -12.0, 0.0),
                report("r3", "WBC", Recommendation.HOLD, 1.5, null),
                report("r4", "ANZ", Recommendation.BUY, 11.0, 0.9),
                report("r5", "NAB", Recommendation.STRONG_BUY, null, null));

        PerformanceSummary summary = aggregator.summarize(reports);

        assertEquals(5, summary.getTotalReports());
        assertEquals(4, summary.getReportsWithPerformance());
        assertEquals(4.79, summary.getTotalPerformance(), 1e-9);
        // r3 has no accuracy score and is left out of the mean
        assertEquals((0.54 + 0.0 + 0.9) / 3, summary.getAverageAccuracy(), 1e-9);

        assertEquals("r4", summary.getBestPerformer().getReportId());
        assertEquals("ANZ", summary.getBestPerformer().getSymbol());
        assertEquals("r2", summary.getWorstPerformer().getReportId());
        assertEquals(-12.0, summary.getWorstPerformer().getPerformance(), 0.0);

        PerformanceSummary.RecommendationStats buy = summary.getRecommendationAccuracy().get("buy");
        assertEquals(2, buy.getTotal());
        assertEquals(2, buy.getPositive());
        assertEquals(1.0, buy.getAccuracy(), 0.0);
        assertEquals(1, summary.getRecommendationAccuracy().get("sell").getPositive());
        assertEquals(1, summary.getRecommendationAccuracy().get("hold").getPositive());
        // no snapshot, no entry
        assertNull(summary.getRecommendationAccuracy().get("strong_buy"));

        assertEquals(1, summary.getPerformanceDistribution().get("excellent"));
        assertEquals(0, summary.getPerformanceDistribution().get("good"));
        assertEquals(2, summary.getPerformanceDistribution().get("neutral"));
        assertEquals(0, summary.getPerformanceDistribution().get("poor"));
        assertEquals(1, summary.getPerformanceDistribution().get("terrible"));
        int distributed = summary.getPerformanceDistribution().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(summary.getReportsWithPerformance(), distributed);
    }

    @Test
    void summarize_holdOutsideBand_shouldCountAsIncorrect() {
        PerformanceSummary summary = aggregator.summarize(Collections.singletonList(
                report("r1", "CBA", Recommendation.HOLD, 3.5, null)));

        PerformanceSummary.RecommendationStats hold = summary.getRecommendationAccuracy().get("hold");
        assertEquals(1, hold.getTotal());
        assertEquals(0, hold.getPositive());
        assertEquals(0.0, hold.getAccuracy(), 0.0);
    }

    @Test
    void summarize_snapshotNotYetReEvaluated_shouldCountAsFlatNeutralEntry() {
        AnalysisReport fresh = new AnalysisReport("user-1", "WBC", RiskLevel.MODERATE, "1y");
        fresh.setId("r2");
        fresh.setResults(AnalysisResults.builder().recommendation(Recommendation.BUY).currentPrice(27.10).build());
        fresh.attachPerformance(new ReportPerformance("WBC", 27.10, 10.7));

        PerformanceSummary summary = aggregator.summarize(Arrays.asList(
                report("r1", "CBA", Recommendation.BUY, -3.0, 0.0), fresh));

        assertEquals(2, summary.getReportsWithPerformance());
        assertEquals(0.0, summary.getAverageAccuracy(), 0.0);
        assertEquals(2, summary.getPerformanceDistribution().get("neutral"));
        assertEquals("r2", summary.getBestPerformer().getReportId());
        assertEquals(0.0, summary.getBestPerformer().getPerformance(), 0.0);
        assertEquals(0, summary.getRecommendationAccuracy().get("buy").getPositive());
    }

    private static AnalysisReport report(String id, String symbol, Recommendation recommendation,
                                         Double performancePct, Double accuracy) {
        AnalysisReport report = new AnalysisReport("user-1", symbol, RiskLevel.MODERATE, "1y");
        report.setId(id);
        report.setResults(AnalysisResults.builder()
                .recommendation(recommendation)
                .currentPrice(100.0)
                .build());
        if (performancePct != null) {
            ReportPerformance performance = new ReportPerformance(symbol, 100.0, 5.0);
            performance.setPerformancePct(performancePct);
            performance.setAccuracyScore(accuracy);
            report.attachPerformance(performance);
        }
        return report;
    }
}
