package com.mugpunters.backend.service.market;

import com.mugpunters.backend.service.client.YahooChartClient;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Index return from the close on the analysis date to the latest index level.
 */
public class YahooFinanceBenchmarkSource implements BenchmarkSource {

    private final YahooChartClient chartClient;
    private final String indexSymbol;
    private final String benchmarkName;

    public YahooFinanceBenchmarkSource(YahooChartClient chartClient, String indexSymbol, String benchmarkName) {
        this.chartClient = chartClient;
        this.indexSymbol = indexSymbol;
        this.benchmarkName = benchmarkName;
    }

    @Override
    public String getBenchmarkName() {
        return benchmarkName;
    }

    @Override
    public BenchmarkReturn getReturnSince(LocalDateTime since, Duration timeout) {
        double returnPct = chartClient.fetchReturnSince(indexSymbol, since, timeout);
        return new BenchmarkReturn(benchmarkName, returnPct);
    }
}
