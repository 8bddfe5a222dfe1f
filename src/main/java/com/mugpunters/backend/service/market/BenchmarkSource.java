package com.mugpunters.backend.service.market;

import com.mugpunters.backend.exception.PriceUnavailableException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Reference return of a market index, used to judge whether a report beat the market.
 */
public interface BenchmarkSource {

    String getBenchmarkName();

    /**
     * @param since Start of the measured period, normally the analysis date.
     * @param timeout Upper bound for the lookup.
     * @return The index return in percent from {@code since} until now.
     * @throws PriceUnavailableException If the index data cannot be fetched in time.
     */
    BenchmarkReturn getReturnSince(LocalDateTime since, Duration timeout) throws PriceUnavailableException;
}
