package com.mugpunters.backend.exception;

/**
 * Unknown or soft-deleted report, or a report without a performance snapshot yet.
 */
public class ReportNotFoundException extends ReportTrackingException {
    private final String reportId;

    public ReportNotFoundException(String reportId) {
        this(reportId, "Report " + reportId + " not found");
    }

    public ReportNotFoundException(String reportId, String message) {
        super(message);
        this.reportId = reportId;
    }

    public String getReportId() {
        return reportId;
    }
}
