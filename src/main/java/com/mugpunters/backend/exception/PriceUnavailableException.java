package com.mugpunters.backend.exception;

/**
 * The market data collaborator failed or timed out. Safe to retry: nothing is written on this path.
 */
public class PriceUnavailableException extends ReportTrackingException {
    private final String symbol;

    public PriceUnavailableException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public PriceUnavailableException(String symbol, String message, Throwable cause) {
        super("[" + symbol + "] " + message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
