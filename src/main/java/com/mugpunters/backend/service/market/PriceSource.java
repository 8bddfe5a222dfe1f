package com.mugpunters.backend.service.market;

import com.mugpunters.backend.exception.PriceUnavailableException;

import java.time.Duration;

/**
 * Supplies the current market price of a stock. Implementations are selected through
 * {@code reports.price-source.type}.
 */
public interface PriceSource {

    /**
     * Gets the unique name of the source (e.g. "YAHOO", "FIXED").
     * @return The source's name.
     */
    String getSourceName();

    /**
     * Looks up the latest price for a symbol.
     *
     * @param symbol The exchange-local stock symbol, e.g. "CBA".
     * @param timeout Upper bound for the whole lookup.
     * @return A positive price with the time it was quoted.
     * @throws PriceUnavailableException If the source cannot answer within the timeout.
     */
    PriceQuote getCurrentPrice(String symbol, Duration timeout) throws PriceUnavailableException;
}
