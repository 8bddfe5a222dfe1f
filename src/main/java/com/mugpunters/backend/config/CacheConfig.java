package com.mugpunters.backend.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String PRICE_QUOTE_CACHE = "priceQuoteCache";

    @Bean
    public CacheManager cacheManager(ReportTrackingProperties properties) {
        ReportTrackingProperties.PriceSource priceSource = properties.getPriceSource();
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(PRICE_QUOTE_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .initialCapacity(50)
                .maximumSize(priceSource.getQuoteCacheMaxSize())
                .expireAfterWrite(priceSource.getQuoteCacheTtl())
                .recordStats());
        return cacheManager;
    }
}
