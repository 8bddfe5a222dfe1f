package com.mugpunters.backend.dto;

import com.mugpunters.backend.model.AnalysisResults;
import com.mugpunters.backend.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateReportRequest {
    private String stockSymbol;
    private RiskLevel riskLevel;
    @Builder.Default
    private String timeframe = "1y";
    private Map<String, Object> parameters;
    private AnalysisResults results;
}
