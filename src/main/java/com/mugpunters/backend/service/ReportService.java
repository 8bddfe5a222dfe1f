package com.mugpunters.backend.service;

import com.mugpunters.backend.config.ReportTrackingProperties;
import com.mugpunters.backend.dto.CreateReportRequest;
import com.mugpunters.backend.dto.ReportFilter;
import com.mugpunters.backend.dto.ReportView;
import com.mugpunters.backend.exception.InvalidInputException;
import com.mugpunters.backend.exception.PriceUnavailableException;
import com.mugpunters.backend.exception.ReportNotFoundException;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.AnalysisResults;
import com.mugpunters.backend.model.ReportPerformance;
import com.mugpunters.backend.service.market.PriceQuote;
import com.mugpunters.backend.service.market.PriceSource;
import com.mugpunters.backend.service.store.ReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Saves, lists and soft-deletes a user's analysis reports.
 */
@Service
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    static final Set<String> REQUIRED_PARAMETER_KEYS = Set.of("technical_indicators", "fundamental_metrics", "risk_factors");
    static final int MAX_SYMBOL_LENGTH = 10;
    static final int MAX_PAGE_SIZE = 1000;

    private final ReportStore reportStore;
    private final PriceSource priceSource;
    private final ReportTrackingProperties properties;
    private final Clock clock;

    public ReportService(ReportStore reportStore,
                         PriceSource priceSource,
                         ReportTrackingProperties properties,
                         Clock clock) {
        this.reportStore = reportStore;
        this.priceSource = priceSource;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates and saves a new report with its initial snapshot. A missing analysis price is
     * looked up first, outside any transaction; the report and snapshot are then written together.
     */
    public ReportView createReport(String userId, CreateReportRequest request) {
        requireUser(userId);
        if (request == null) {
            throw new InvalidInputException("Report body is required");
        }
        String symbol = normaliseSymbol(request.getStockSymbol());
        if (request.getRiskLevel() == null) {
            throw new InvalidInputException("Risk level is required");
        }
        validateParameters(request.getParameters());
        AnalysisResults results = request.getResults();
        validateResults(results);

        double originalPrice = results.getCurrentPrice() != null
                ? results.getCurrentPrice()
                : lookUpPrice(symbol);
        results.setCurrentPrice(originalPrice);

        String timeframe = request.getTimeframe() != null && !request.getTimeframe().isBlank()
                ? request.getTimeframe().trim()
                : "1y";

        LocalDateTime now = LocalDateTime.now(clock);
        AnalysisReport report = new AnalysisReport(userId, symbol, request.getRiskLevel(), timeframe);
        report.setParameters(new LinkedHashMap<>(request.getParameters()));
        report.setResults(results);
        report.setCreatedAt(now);
        report.setLastUpdated(now);

        ReportPerformance initial = new ReportPerformance(symbol, originalPrice,
                ReportEvaluationService.predictedReturnFor(results, originalPrice));
        initial.setLastUpdated(now);
        initial.setCreatedAt(now);

        AnalysisReport saved = reportStore.saveNewReport(report, initial);

        logger.info("Saved analysis report {} for {} (user {}) at original price {}",
                saved.getId(), symbol, userId, originalPrice);
        return ReportView.from(saved);
    }

    public List<ReportView> listReports(String userId, ReportFilter filter) {
        requireUser(userId);
        ReportFilter effective = filter != null ? filter : ReportFilter.none();
        if (effective.getSkip() < 0) {
            throw new InvalidInputException("skip must not be negative");
        }
        if (effective.getLimit() != null && (effective.getLimit() < 1 || effective.getLimit() > MAX_PAGE_SIZE)) {
            throw new InvalidInputException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        List<ReportView> reports = reportStore.loadAll(userId, effective).stream()
                .map(ReportView::from)
                .collect(Collectors.toList());
        logger.debug("Listed {} reports for user {}", reports.size(), userId);
        return reports;
    }

    public ReportView getReport(String userId, String reportId) {
        return ReportView.from(requireOwnedReport(userId, reportId));
    }

    public void deactivateReport(String userId, String reportId) {
        AnalysisReport report = requireOwnedReport(userId, reportId);
        report.setActive(false);
        report.setLastUpdated(LocalDateTime.now(clock));
        reportStore.saveReport(report);
        logger.info("Deactivated report {} for user {}", reportId, userId);
    }

    /**
     * Active report belonging to {@code userId}. Reports of other users are reported as missing.
     */
    public AnalysisReport requireOwnedReport(String userId, String reportId) {
        requireUser(userId);
        return reportStore.load(reportId)
                .filter(AnalysisReport::isActive)
                .filter(report -> userId.equals(report.getUserId()))
                .orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    private double lookUpPrice(String symbol) {
        PriceQuote quote;
        try {
            quote = priceSource.getCurrentPrice(symbol, properties.getEvaluation().getPriceTimeout());
        } catch (PriceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Price source {} failed for {}: {}", priceSource.getSourceName(), symbol, e.getMessage());
            throw new PriceUnavailableException(symbol, "Price source failed: " + e.getMessage(), e);
        }
        if (quote == null || !(quote.getPrice() > 0)) {
            throw new PriceUnavailableException(symbol, "Price source returned no usable price");
        }
        logger.debug("No analysis price supplied for {}, using {} quote {}", symbol,
                priceSource.getSourceName(), quote.getPrice());
        return quote.getPrice();
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidInputException("User id is required");
        }
    }

    private static String normaliseSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidInputException("Stock symbol is required");
        }
        String normalised = symbol.trim().toUpperCase();
        if (normalised.length() > MAX_SYMBOL_LENGTH) {
            throw new InvalidInputException("Stock symbol is too long: " + normalised);
        }
        return normalised;
    }

    private static void validateParameters(Map<String, Object> parameters) {
        if (parameters == null) {
            throw new InvalidInputException("Analysis parameters are required");
        }
        for (String key : REQUIRED_PARAMETER_KEYS) {
            if (!parameters.containsKey(key)) {
                throw new InvalidInputException("Missing required parameter: " + key);
            }
        }
    }

    private static void validateResults(AnalysisResults results) {
        if (results == null) {
            throw new InvalidInputException("Analysis results are required");
        }
        if (results.getRecommendation() == null) {
            throw new InvalidInputException("Recommendation is required");
        }
        requireScore("technicalScore", results.getTechnicalScore());
        requireScore("fundamentalScore", results.getFundamentalScore());
        requireScore("riskScore", results.getRiskScore());
        requireScore("overallScore", results.getOverallScore());
        if (results.getConfidence() == null || results.getConfidence() < 0 || results.getConfidence() > 1) {
            throw new InvalidInputException("confidence must be between 0 and 1");
        }
        if (results.getTargetPrice() != null && !(results.getTargetPrice() > 0)) {
            throw new InvalidInputException("targetPrice must be positive");
        }
        if (results.getCurrentPrice() != null && !(results.getCurrentPrice() > 0)) {
            throw new InvalidInputException("currentPrice must be positive");
        }
    }

    private static void requireScore(String name, Double score) {
        if (score == null || score < 0 || score > 100) {
            throw new InvalidInputException(name + " must be between 0 and 100");
        }
    }
}
