package com.mugpunters.backend.service.market;

import java.time.Duration;
import java.time.LocalDateTime;

public class FixedBenchmarkSource implements BenchmarkSource {

    private final String benchmarkName;
    private final double returnPct;

    public FixedBenchmarkSource(String benchmarkName, double returnPct) {
        this.benchmarkName = benchmarkName;
        this.returnPct = returnPct;
    }

    @Override
    public String getBenchmarkName() {
        return benchmarkName;
    }

    @Override
    public BenchmarkReturn getReturnSince(LocalDateTime since, Duration timeout) {
        return new BenchmarkReturn(benchmarkName, returnPct);
    }
}
