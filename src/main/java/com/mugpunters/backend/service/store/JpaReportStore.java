package com.mugpunters.backend.service.store;

import com.mugpunters.backend.dto.ReportFilter;
import com.mugpunters.backend.exception.InvalidInputException;
import com.mugpunters.backend.exception.ReportNotFoundException;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.ReportPerformance;
import com.mugpunters.backend.repository.AnalysisReportRepository;
import com.mugpunters.backend.repository.ReportPerformanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class JpaReportStore implements ReportStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaReportStore.class);

    private final AnalysisReportRepository reportRepository;
    private final ReportPerformanceRepository performanceRepository;

    public JpaReportStore(AnalysisReportRepository reportRepository,
                          ReportPerformanceRepository performanceRepository) {
        this.reportRepository = reportRepository;
        this.performanceRepository = performanceRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisReport> load(String reportId) {
        return reportRepository.findById(reportId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnalysisReport> loadAll(String userId, ReportFilter filter) {
        ReportFilter effective = filter != null ? filter : ReportFilter.none();
        String symbol = effective.getStockSymbol() != null ? effective.getStockSymbol().trim().toUpperCase() : null;

        Stream<AnalysisReport> reports = reportRepository.findActiveForUser(
                        userId, effective.getRiskLevel(), effective.getTimeframe(), symbol)
                .stream()
                .skip(Math.max(0, effective.getSkip()));
        if (effective.getLimit() != null) {
            reports = reports.limit(Math.max(0, effective.getLimit()));
        }
        return reports.collect(Collectors.toList());
    }

    @Override
    @Transactional
    public AnalysisReport saveReport(AnalysisReport report) {
        return reportRepository.save(report);
    }

    @Override
    @Transactional
    public AnalysisReport saveNewReport(AnalysisReport report, ReportPerformance initial) {
        AnalysisReport saved = saveReport(report);
        saved.attachPerformance(initial);
        savePerformance(initial);
        return saved;
    }

    @Override
    @Transactional
    public ReportPerformance savePerformance(ReportPerformance performance) {
        if (performance.getReport() == null) {
            throw new InvalidInputException("A performance snapshot must belong to a report");
        }
        return performanceRepository.save(performance);
    }

    @Override
    @Transactional
    public ReportPerformance saveEvaluation(String reportId, ReportPerformance evaluated) {
        AnalysisReport report = reportRepository.findByIdForUpdate(reportId)
                .filter(AnalysisReport::isActive)
                .orElseThrow(() -> new ReportNotFoundException(reportId));

        ReportPerformance stored = report.getPerformance();
        if (stored == null) {
            evaluated.setId(null);
            report.attachPerformance(evaluated);
            logger.debug("Creating first performance snapshot for report {}", reportId);
        } else {
            stored.overwriteWith(evaluated);
        }

        if (evaluated.getLastUpdated() != null && !evaluated.getLastUpdated().isBefore(report.getCreatedAt())) {
            report.setLastUpdated(evaluated.getLastUpdated());
        }
        // merge may swap a new snapshot for its managed copy
        return reportRepository.save(report).getPerformance();
    }
}
