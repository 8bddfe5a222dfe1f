package com.mugpunters.backend.dto;

import com.mugpunters.backend.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional filters applied by the store before reports reach the tracker. Null fields match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportFilter {
    private RiskLevel riskLevel;
    private String timeframe;
    private String stockSymbol;
    @Builder.Default
    private int skip = 0;
    private Integer limit;

    public static ReportFilter none() {
        return new ReportFilter();
    }
}
