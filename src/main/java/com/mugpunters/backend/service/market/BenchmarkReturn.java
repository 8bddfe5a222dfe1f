package com.mugpunters.backend.service.market;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkReturn {
    private String benchmarkName;
    private double returnPct;
}
