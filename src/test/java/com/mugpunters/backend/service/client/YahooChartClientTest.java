package com.mugpunters.backend.service.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mugpunters.backend.exception.PriceUnavailableException;
import com.mugpunters.backend.service.market.PriceQuote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class YahooChartClientTest {

    private static final String QUOTE_BODY = "{\"chart\":{\"result\":[{\"meta\":{\"symbol\":\"CBA.AX\","
            + "\"regularMarketPrice\":92.3,\"regularMarketTime\":1711954800},"
            + "\"indicators\":{\"quote\":[{\"close\":[91.8,92.3]}]}}],\"error\":null}}";

    private static final String HISTORY_BODY = "{\"chart\":{\"result\":[{\"meta\":{\"symbol\":\"^AXJO\"},"
            + "\"indicators\":{\"quote\":[{\"close\":[null,7500.0,7600.0,7650.0]}]}}],\"error\":null}}";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC);

    private YahooChartClient client;

    @BeforeEach
    void setUp() {
        client = new YahooChartClient(new ObjectMapper(), "https://chart.test/", httpClient, CLOCK);
    }

    @Test
    void fetchQuote_shouldReadRegularMarketPrice() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(QUOTE_BODY);
        doReturn(response).when(httpClient).send(any(), any());

        PriceQuote quote = client.fetchQuote("CBA.AX", Duration.ofSeconds(3));

        assertEquals(92.3, quote.getPrice(), 0.0);
        assertEquals("CBA.AX", quote.getSymbol());

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertTrue(request.getValue().uri().toString().startsWith("https://chart.test/v8/finance/chart/CBA.AX?"));
        assertEquals(Duration.ofSeconds(3), request.getValue().timeout().orElseThrow());
    }

    @Test
    void fetchQuote_timeout_shouldBeUnavailable() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());

        PriceUnavailableException ex = assertThrows(PriceUnavailableException.class,
                () -> client.fetchQuote("CBA.AX", Duration.ofMillis(500)));
        assertTrue(ex.getMessage().contains("timed out"));
    }

    @Test
    void fetchQuote_httpError_shouldBeUnavailable() throws Exception {
        when(response.statusCode()).thenReturn(404);
        doReturn(response).when(httpClient).send(any(), any());

        assertThrows(PriceUnavailableException.class, () -> client.fetchQuote("NOPE.AX", Duration.ofSeconds(1)));
    }

    @Test
    void parseQuote_shouldFallBackToLastClose() {
        String body = "{\"chart\":{\"result\":[{\"meta\":{},"
                + "\"indicators\":{\"quote\":[{\"close\":[39.1,39.8,null]}]}}],\"error\":null}}";

        PriceQuote quote = client.parseQuote("BHP.AX", body);

        assertEquals(39.8, quote.getPrice(), 0.0);
    }

    @Test
    void parseQuote_chartError_shouldBeUnavailable() {
        String body = "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\","
                + "\"description\":\"No data found, symbol may be delisted\"}}}";

        PriceUnavailableException ex = assertThrows(PriceUnavailableException.class,
                () -> client.parseQuote("XYZ.AX", body));
        assertTrue(ex.getMessage().contains("delisted"));
    }

    @Test
    void parseQuote_garbage_shouldBeUnavailable() {
        assertThrows(PriceUnavailableException.class, () -> client.parseQuote("CBA.AX", "<html>"));
    }

    @Test
    void parseReturnSince_shouldCompareFirstCloseWithLatest() {
        double returnPct = client.parseReturnSince("^AXJO", HISTORY_BODY);

        assertEquals(2.0, returnPct, 1e-9);
    }

    @Test
    void fetchReturnSince_shouldBoundPeriodWithClock() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(HISTORY_BODY);
        doReturn(response).when(httpClient).send(any(), any());

        double returnPct = client.fetchReturnSince("^AXJO", LocalDateTime.of(2024, 3, 1, 0, 0), Duration.ofSeconds(3));

        assertEquals(2.0, returnPct, 1e-9);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        String uri = request.getValue().uri().toString();
        assertTrue(uri.contains("period1=1709251200&period2=1711929600"), uri);
    }

    @Test
    void parseQuote_withoutMarketTime_shouldStampWithClock() {
        String body = "{\"chart\":{\"result\":[{\"meta\":{\"regularMarketPrice\":39.8}}],\"error\":null}}";

        PriceQuote quote = client.parseQuote("BHP.AX", body);

        assertEquals(LocalDateTime.of(2024, 4, 1, 0, 0), quote.getTimestamp());
    }
}
