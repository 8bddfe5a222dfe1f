package com.mugpunters.backend.service.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mugpunters.backend.exception.PriceUnavailableException;
import com.mugpunters.backend.service.market.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Thin client for the Yahoo Finance v8 chart endpoint. Every call carries its own timeout.
 */
public class YahooChartClient {

    private static final Logger logger = LoggerFactory.getLogger(YahooChartClient.class);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Clock clock;

    public YahooChartClient(ObjectMapper objectMapper, String baseUrl, Clock clock) {
        this(objectMapper, baseUrl, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build(), clock);
    }

    YahooChartClient(ObjectMapper objectMapper, String baseUrl, HttpClient httpClient, Clock clock) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    public PriceQuote fetchQuote(String symbol, Duration timeout) {
        String body = fetchChart(symbol, "range=1d&interval=1d", timeout);
        return parseQuote(symbol, body);
    }

    /**
     * Percentage change from the first daily close on or after {@code since} to the latest price.
     */
    public double fetchReturnSince(String symbol, LocalDateTime since, Duration timeout) {
        long period1 = since.atZone(clock.getZone()).toEpochSecond();
        long period2 = clock.instant().getEpochSecond();
        String body = fetchChart(symbol, "period1=" + period1 + "&period2=" + period2 + "&interval=1d", timeout);
        return parseReturnSince(symbol, body);
    }

    PriceQuote parseQuote(String symbol, String body) {
        JsonNode result = firstResult(symbol, body);
        JsonNode meta = result.path("meta");
        double price = meta.path("regularMarketPrice").asDouble(Double.NaN);
        if (Double.isNaN(price)) {
            price = lastClose(result);
        }
        if (!(price > 0)) {
            throw new PriceUnavailableException(symbol, "Chart response carried no usable price");
        }
        LocalDateTime timestamp = meta.hasNonNull("regularMarketTime")
                ? LocalDateTime.ofInstant(Instant.ofEpochSecond(meta.get("regularMarketTime").asLong()), clock.getZone())
                : LocalDateTime.now(clock);
        return new PriceQuote(symbol, price, timestamp);
    }

    double parseReturnSince(String symbol, String body) {
        JsonNode result = firstResult(symbol, body);
        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        double first = Double.NaN;
        for (JsonNode close : closes) {
            if (close.isNumber() && close.asDouble() > 0) {
                first = close.asDouble();
                break;
            }
        }
        double latest = result.path("meta").path("regularMarketPrice").asDouble(Double.NaN);
        if (Double.isNaN(latest)) {
            latest = lastClose(result);
        }
        if (!(first > 0) || !(latest > 0)) {
            throw new PriceUnavailableException(symbol, "Not enough index history to compute a return");
        }
        return (latest - first) / first * 100.0;
    }

    private String fetchChart(String symbol, String query, Duration timeout) {
        String url = baseUrl + "/v8/finance/chart/" + URLEncoder.encode(symbol, StandardCharsets.UTF_8) + "?" + query;
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", "MugPunters-Report-Tracker/1.0")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                logger.warn("Chart request for {} answered HTTP {}", symbol, response.statusCode());
                throw new PriceUnavailableException(symbol, "Market data request failed with HTTP " + response.statusCode());
            }
            return response.body();
        } catch (HttpTimeoutException e) {
            throw new PriceUnavailableException(symbol, "Market data request timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new PriceUnavailableException(symbol, "Market data request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PriceUnavailableException(symbol, "Market data request interrupted", e);
        }
    }

    private JsonNode firstResult(String symbol, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode chart = root.path("chart");
            if (chart.hasNonNull("error")) {
                throw new PriceUnavailableException(symbol, "Market data error: " + chart.path("error").path("description").asText());
            }
            JsonNode result = chart.path("result").path(0);
            if (result.isMissingNode() || result.isNull()) {
                throw new PriceUnavailableException(symbol, "Chart response had no result");
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new PriceUnavailableException(symbol, "Unreadable chart response", e);
        }
    }

    private static double lastClose(JsonNode result) {
        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        for (int i = closes.size() - 1; i >= 0; i--) {
            JsonNode close = closes.get(i);
            if (close.isNumber() && close.asDouble() > 0) {
                return close.asDouble();
            }
        }
        return Double.NaN;
    }
}
