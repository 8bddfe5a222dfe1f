package com.mugpunters.backend.config;

import com.mugpunters.backend.service.util.PerformanceCalculator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "reports")
public class ReportTrackingProperties {

    private Evaluation evaluation = new Evaluation();
    private PriceSource priceSource = new PriceSource();
    private Benchmark benchmark = new Benchmark();

    @Data
    public static class Evaluation {
        // Open question: what counts as a correct "hold"; confirm with product owner
        private double holdNeutralityBandPct = PerformanceCalculator.DEFAULT_HOLD_NEUTRALITY_BAND_PCT;
        private Duration priceTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class PriceSource {
        // yahoo | fixed
        private String type = "yahoo";
        private String baseUrl = "https://query1.finance.yahoo.com";
        private String exchangeSuffix = ".AX";
        private Duration quoteCacheTtl = Duration.ofMinutes(5);
        private long quoteCacheMaxSize = 500;
        private Map<String, Double> fixedPrices = new LinkedHashMap<>();

        // Yahoo symbols carry an exchange suffix, e.g. CBA -> CBA.AX
        public String toProviderSymbol(String symbol) {
            String clean = symbol.trim().toUpperCase();
            if (clean.startsWith("^") || exchangeSuffix == null || exchangeSuffix.isEmpty()
                    || clean.endsWith(exchangeSuffix.toUpperCase())) {
                return clean;
            }
            return clean + exchangeSuffix.toUpperCase();
        }
    }

    @Data
    public static class Benchmark {
        // yahoo | fixed
        private String type = "yahoo";
        private String symbol = "^AXJO";
        private String name = "ASX 200";
        private Double fixedReturnPct = 2.5;
    }
}
