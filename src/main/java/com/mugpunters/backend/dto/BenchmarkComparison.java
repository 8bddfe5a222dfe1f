package com.mugpunters.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkComparison {
    private String benchmarkName;
    private Double benchmarkPerformance;
    private Double outperformance;
}
