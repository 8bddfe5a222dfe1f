package com.mugpunters.backend.service.store;

import com.mugpunters.backend.dto.ReportFilter;
import com.mugpunters.backend.exception.InvalidInputException;
import com.mugpunters.backend.exception.ReportNotFoundException;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.AnalysisResults;
import com.mugpunters.backend.model.Recommendation;
import com.mugpunters.backend.model.ReportPerformance;
import com.mugpunters.backend.model.RiskLevel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(JpaReportStore.class)
public class JpaReportStoreTest {

    private static final LocalDateTime CREATED_AT = LocalDateTime.of(2024, 3, 1, 10, 0);

    @Autowired
    private JpaReportStore reportStore;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void saveReport_shouldPersistReportWithInitialSnapshot() {
        AnalysisReport saved = reportStore.saveReport(newReport("user-1", "CBA", RiskLevel.MODERATE, CREATED_AT, true));
        entityManager.flush();
        entityManager.clear();

        AnalysisReport loaded = reportStore.load(saved.getId()).orElseThrow();
        assertNotNull(loaded.getId());
        assertEquals("CBA", loaded.getStockSymbol());
        assertEquals(Recommendation.BUY, loaded.getRecommendation());
        assertEquals(3, loaded.getParameters().size());
        assertNotNull(loaded.getPerformance());
        assertEquals(88.50, loaded.getPerformance().getOriginalPrice(), 0.0);
        assertEquals(loaded.getId(), loaded.getPerformance().getReportId());
    }

    @Test
    void savePerformance_shouldAttachSnapshotToStoredReport() {
        AnalysisReport saved = reportStore.saveReport(newReport("user-1", "BHP", RiskLevel.CONSERVATIVE, CREATED_AT, false));
        ReportPerformance performance = new ReportPerformance("BHP", 39.80, null);
        performance.setLastUpdated(CREATED_AT);
        saved.attachPerformance(performance);
        reportStore.savePerformance(performance);
        entityManager.flush();
        entityManager.clear();

        ReportPerformance loaded = reportStore.load(saved.getId()).orElseThrow().getPerformance();
        assertNotNull(loaded);
        assertEquals(39.80, loaded.getCurrentPrice(), 0.0);
        assertEquals(0.0, loaded.getPerformancePct(), 0.0);
    }

    @Test
    void saveNewReport_shouldWriteReportAndInitialSnapshotTogether() {
        ReportPerformance initial = new ReportPerformance("WBC", 27.10, 10.7);
        initial.setLastUpdated(CREATED_AT);
        AnalysisReport saved = reportStore.saveNewReport(
                newReport("user-1", "WBC", RiskLevel.MODERATE, CREATED_AT, false), initial);
        entityManager.flush();
        entityManager.clear();

        ReportPerformance loaded = reportStore.load(saved.getId()).orElseThrow().getPerformance();
        assertNotNull(loaded);
        assertEquals(saved.getId(), loaded.getReportId());
        assertEquals(27.10, loaded.getOriginalPrice(), 0.0);
        assertEquals(10.7, loaded.getPredictedReturn(), 0.0);
    }

    @Test
    void savePerformance_withoutReport_shouldBeRejected() {
        assertThrows(InvalidInputException.class,
                () -> reportStore.savePerformance(new ReportPerformance("BHP", 39.80, null)));
    }

    @Test
    void loadAll_shouldReturnActiveReportsOfUserNewestFirst() {
        reportStore.saveReport(newReport("user-1", "CBA", RiskLevel.MODERATE, CREATED_AT, true));
        reportStore.saveReport(newReport("user-1", "BHP", RiskLevel.AGGRESSIVE, CREATED_AT.plusDays(1), true));
        AnalysisReport deleted = newReport("user-1", "WBC", RiskLevel.MODERATE, CREATED_AT.plusDays(2), true);
        deleted.setActive(false);
        reportStore.saveReport(deleted);
        reportStore.saveReport(newReport("user-2", "ANZ", RiskLevel.MODERATE, CREATED_AT, true));
        entityManager.flush();
        entityManager.clear();

        List<String> all = symbols(reportStore.loadAll("user-1", ReportFilter.none()));
        assertEquals(List.of("BHP", "CBA"), all);

        assertEquals(List.of("CBA"), symbols(reportStore.loadAll("user-1",
                ReportFilter.builder().riskLevel(RiskLevel.MODERATE).build())));
        assertEquals(List.of("CBA"), symbols(reportStore.loadAll("user-1",
                ReportFilter.builder().stockSymbol(" cba").build())));
        assertEquals(List.of("CBA"), symbols(reportStore.loadAll("user-1",
                ReportFilter.builder().skip(1).limit(5).build())));
        assertEquals(List.of("BHP"), symbols(reportStore.loadAll("user-1",
                ReportFilter.builder().limit(1).build())));
        assertTrue(reportStore.loadAll("user-3", ReportFilter.none()).isEmpty());
    }

    @Test
    void saveEvaluation_shouldOverwriteSnapshotInPlace() {
        AnalysisReport saved = reportStore.saveReport(newReport("user-1", "CBA", RiskLevel.MODERATE, CREATED_AT, true));
        entityManager.flush();
        Long snapshotId = saved.getPerformance().getId();
        entityManager.clear();

        LocalDateTime evaluatedAt = CREATED_AT.plusDays(31);
        reportStore.saveEvaluation(saved.getId(), evaluated(92.30, 4.2938, 0.5429, evaluatedAt));
        entityManager.flush();
        entityManager.clear();

        reportStore.saveEvaluation(saved.getId(), evaluated(90.00, 1.6949, 0.2143, evaluatedAt.plusDays(1)));
        entityManager.flush();
        entityManager.clear();

        AnalysisReport loaded = reportStore.load(saved.getId()).orElseThrow();
        ReportPerformance performance = loaded.getPerformance();
        assertEquals(snapshotId, performance.getId());
        assertEquals(88.50, performance.getOriginalPrice(), 0.0);
        assertEquals(7.9096, performance.getPredictedReturn(), 1e-4);
        assertEquals(90.00, performance.getCurrentPrice(), 0.0);
        assertEquals(1.6949, performance.getPerformancePct(), 0.0);
        assertEquals(evaluatedAt.plusDays(1), performance.getLastUpdated());
        assertEquals(evaluatedAt.plusDays(1), loaded.getLastUpdated());
        assertEquals(1L, entityManager.getEntityManager()
                .createQuery("SELECT COUNT(p) FROM ReportPerformance p", Long.class)
                .getSingleResult());
    }

    @Test
    void saveEvaluation_withoutSnapshot_shouldCreateOne() {
        AnalysisReport saved = reportStore.saveReport(newReport("user-1", "CBA", RiskLevel.MODERATE, CREATED_AT, false));
        entityManager.flush();
        entityManager.clear();

        reportStore.saveEvaluation(saved.getId(), evaluated(92.30, 4.2938, 0.5429, CREATED_AT.plusDays(31)));
        entityManager.flush();
        entityManager.clear();

        ReportPerformance performance = reportStore.load(saved.getId()).orElseThrow().getPerformance();
        assertNotNull(performance);
        assertEquals(92.30, performance.getCurrentPrice(), 0.0);
        assertEquals("FIXED", performance.getMarketConditions().get("priceSource"));
    }

    @Test
    void saveEvaluation_inactiveReport_shouldBeNotFound() {
        AnalysisReport report = newReport("user-1", "CBA", RiskLevel.MODERATE, CREATED_AT, true);
        report.setActive(false);
        AnalysisReport saved = reportStore.saveReport(report);
        entityManager.flush();
        entityManager.clear();

        assertThrows(ReportNotFoundException.class, () -> reportStore.saveEvaluation(saved.getId(),
                evaluated(92.30, 4.2938, 0.5429, CREATED_AT.plusDays(1))));
        assertThrows(ReportNotFoundException.class, () -> reportStore.saveEvaluation("missing",
                evaluated(92.30, 4.2938, 0.5429, CREATED_AT.plusDays(1))));
        assertFalse(reportStore.load(saved.getId()).orElseThrow().isActive());
    }

    private static List<String> symbols(List<AnalysisReport> reports) {
        return reports.stream().map(AnalysisReport::getStockSymbol).collect(Collectors.toList());
    }

    private static ReportPerformance evaluated(double currentPrice, double pct, double accuracy, LocalDateTime at) {
        ReportPerformance performance = new ReportPerformance("CBA", 88.50, 7.9096);
        performance.setCurrentPrice(currentPrice);
        performance.setPerformancePct(pct);
        performance.setActualReturn(currentPrice - 88.50);
        performance.setAccuracyScore(accuracy);
        performance.setDaysSinceAnalysis(31);
        performance.setLastUpdated(at);
        Map<String, Object> conditions = new HashMap<>();
        conditions.put("priceSource", "FIXED");
        performance.setMarketConditions(conditions);
        return performance;
    }

    private static AnalysisReport newReport(String userId, String symbol, RiskLevel riskLevel,
                                            LocalDateTime createdAt, boolean withSnapshot) {
        AnalysisReport report = new AnalysisReport(userId, symbol, riskLevel, "1y");
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("technical_indicators", Collections.singletonList("rsi"));
        parameters.put("fundamental_metrics", Collections.singletonList("pe_ratio"));
        parameters.put("risk_factors", Collections.singletonList("volatility"));
        report.setParameters(parameters);
        report.setResults(AnalysisResults.builder()
                .technicalScore(72.0)
                .fundamentalScore(68.0)
                .riskScore(40.0)
                .overallScore(70.0)
                .recommendation(Recommendation.BUY)
                .confidence(0.75)
                .targetPrice(95.50)
                .currentPrice(88.50)
                .build());
        report.setCreatedAt(createdAt);
        report.setLastUpdated(createdAt);
        if (withSnapshot) {
            ReportPerformance performance = new ReportPerformance(symbol, 88.50, 7.909604519774012);
            performance.setLastUpdated(createdAt);
            report.attachPerformance(performance);
        }
        return report;
    }
}
