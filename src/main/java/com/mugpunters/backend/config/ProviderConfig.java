package com.mugpunters.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mugpunters.backend.service.client.YahooChartClient;
import com.mugpunters.backend.service.market.BenchmarkSource;
import com.mugpunters.backend.service.market.FixedBenchmarkSource;
import com.mugpunters.backend.service.market.FixedPriceSource;
import com.mugpunters.backend.service.market.PriceSource;
import com.mugpunters.backend.service.market.YahooFinanceBenchmarkSource;
import com.mugpunters.backend.service.market.YahooFinancePriceSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProviderConfig {

    @Bean
    public YahooChartClient yahooChartClient(ObjectMapper objectMapper, ReportTrackingProperties properties, Clock clock) {
        return new YahooChartClient(objectMapper, properties.getPriceSource().getBaseUrl(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "reports.price-source.type", havingValue = "yahoo", matchIfMissing = true)
    public PriceSource yahooPriceSource(YahooChartClient chartClient, ReportTrackingProperties properties) {
        return new YahooFinancePriceSource(chartClient, properties.getPriceSource());
    }

    @Bean
    @ConditionalOnProperty(name = "reports.price-source.type", havingValue = "fixed")
    public PriceSource fixedPriceSource(ReportTrackingProperties properties, Clock clock) {
        return new FixedPriceSource(properties.getPriceSource().getFixedPrices(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "reports.benchmark.type", havingValue = "yahoo", matchIfMissing = true)
    public BenchmarkSource yahooBenchmarkSource(YahooChartClient chartClient, ReportTrackingProperties properties) {
        ReportTrackingProperties.Benchmark benchmark = properties.getBenchmark();
        return new YahooFinanceBenchmarkSource(chartClient, benchmark.getSymbol(), benchmark.getName());
    }

    @Bean
    @ConditionalOnProperty(name = "reports.benchmark.type", havingValue = "fixed")
    public BenchmarkSource fixedBenchmarkSource(ReportTrackingProperties properties) {
        ReportTrackingProperties.Benchmark benchmark = properties.getBenchmark();
        return new FixedBenchmarkSource(benchmark.getName(),
                benchmark.getFixedReturnPct() != null ? benchmark.getFixedReturnPct() : 0.0);
    }
}
