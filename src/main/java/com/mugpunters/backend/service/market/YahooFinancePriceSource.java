package com.mugpunters.backend.service.market;

import com.mugpunters.backend.config.CacheConfig;
import com.mugpunters.backend.config.ReportTrackingProperties;
import com.mugpunters.backend.service.client.YahooChartClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;

import java.time.Duration;

/**
 * Live quotes from the Yahoo Finance chart API. Quotes are cached briefly per symbol;
 * failures are never cached.
 */
public class YahooFinancePriceSource implements PriceSource {

    private static final Logger logger = LoggerFactory.getLogger(YahooFinancePriceSource.class);

    private final YahooChartClient chartClient;
    private final ReportTrackingProperties.PriceSource config;

    public YahooFinancePriceSource(YahooChartClient chartClient, ReportTrackingProperties.PriceSource config) {
        this.chartClient = chartClient;
        this.config = config;
    }

    @Override
    public String getSourceName() {
        return "YAHOO";
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.PRICE_QUOTE_CACHE, key = "#symbol.trim().toUpperCase()")
    public PriceQuote getCurrentPrice(String symbol, Duration timeout) {
        String providerSymbol = config.toProviderSymbol(symbol);
        logger.debug("Fetching quote for {} as {}", symbol, providerSymbol);
        PriceQuote quote = chartClient.fetchQuote(providerSymbol, timeout);
        // Report the symbol the way the caller knows it
        quote.setSymbol(symbol.trim().toUpperCase());
        return quote;
    }
}
