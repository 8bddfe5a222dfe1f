package com.mugpunters.backend.service.store;

import com.mugpunters.backend.dto.ReportFilter;
import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.ReportPerformance;

import java.util.List;
import java.util.Optional;

/**
 * Narrow persistence seam used by the tracker. Reports come back with their performance
 * snapshot attached.
 */
public interface ReportStore {

    /**
     * Loads a report regardless of its active flag; callers decide what an inactive report means.
     */
    Optional<AnalysisReport> load(String reportId);

    /**
     * Active reports of a user, newest first, with the filter (and paging) already applied.
     */
    List<AnalysisReport> loadAll(String userId, ReportFilter filter);

    /**
     * Inserts or updates a report; an attached performance snapshot is saved with it.
     */
    AnalysisReport saveReport(AnalysisReport report);

    /**
     * Inserts a new report together with its initial snapshot in one transaction.
     *
     * @return the saved report with {@code initial} attached
     */
    AnalysisReport saveNewReport(AnalysisReport report, ReportPerformance initial);

    /**
     * Saves a snapshot already attached to its report. Re-evaluations go through
     * {@link #saveEvaluation(String, ReportPerformance)} instead.
     */
    ReportPerformance savePerformance(ReportPerformance performance);

    /**
     * Replaces the report's performance snapshot with {@code evaluated} and bumps the report's
     * {@code lastUpdated} as one atomic unit. Concurrent calls for the same report are serialised;
     * the last writer wins. The snapshot's anchor fields are kept when a row already exists.
     *
     * @return the persisted snapshot
     */
    ReportPerformance saveEvaluation(String reportId, ReportPerformance evaluated);
}
