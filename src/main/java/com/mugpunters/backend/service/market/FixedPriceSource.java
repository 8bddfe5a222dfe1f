package com.mugpunters.backend.service.market;

import com.mugpunters.backend.exception.PriceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Serves prices from configuration. Used for local development and demos.
 */
public class FixedPriceSource implements PriceSource {

    private static final Logger logger = LoggerFactory.getLogger(FixedPriceSource.class);

    private final Map<String, Double> prices = new HashMap<>();
    private final Clock clock;

    public FixedPriceSource(Map<String, Double> configuredPrices, Clock clock) {
        if (configuredPrices != null) {
            configuredPrices.forEach((symbol, price) -> prices.put(symbol.trim().toUpperCase(), price));
        }
        this.clock = clock;
        logger.info("Fixed price source configured with {} symbols", prices.size());
    }

    @Override
    public String getSourceName() {
        return "FIXED";
    }

    @Override
    public PriceQuote getCurrentPrice(String symbol, Duration timeout) {
        String key = symbol.trim().toUpperCase();
        Double price = prices.get(key);
        if (price == null || price <= 0) {
            throw new PriceUnavailableException(key, "No configured price");
        }
        return new PriceQuote(key, price, LocalDateTime.now(clock));
    }
}
