package com.swing.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swing.model.PriceBar;
import com.swing.model.PriceSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("YahooFinanceProvider")
class YahooFinanceProviderTest {

    private static final String BASE = "http://yahoo.test";

    /** Four sessions, 13-16 Oct 2026 at 09:15 IST; the third close is missing. */
    private static final String CHART = """
            {"chart": {"result": [{
              "meta": {"symbol": "RELIANCE.NS", "exchangeTimezoneName": "Asia/Kolkata"},
              "timestamp": [1791863100, 1791949500, 1792035900, 1792122300],
              "indicators": {"quote": [{
                "open":   [2900.0, 2910.5, null, 2935.0],
                "high":   [2925.0, 2930.0, null, 2960.0],
                "low":    [2890.0, 2905.0, null, 2930.0],
                "close":  [2915.0, 2920.25, null, 2950.4],
                "volume": [1200000, 980000, null, 1500000]
              }]}
            }], "error": null}}
            """;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private YahooFinanceProvider provider;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        Clock clock = Clock.fixed(Instant.parse("2026-10-17T10:00:00Z"), ZoneOffset.UTC);
        provider = new YahooFinanceProvider(restTemplate, new ObjectMapper(), clock, BASE, ".NS",
                "test-agent", ZoneId.of("Asia/Kolkata"));
    }

    @Test
    @DisplayName("Parses daily bars, drops rows without a close and sends the user agent")
    void fetchDaily() {
        server.expect(requestTo(startsWith(BASE + "/v8/finance/chart/RELIANCE.NS?period1=")))
                .andExpect(requestTo(containsString("interval=1d")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("User-Agent", "test-agent"))
                .andRespond(withSuccess(CHART, MediaType.APPLICATION_JSON));

        PriceSeries series = provider.fetchDaily("RELIANCE", 90);

        server.verify();
        assertThat(series.getSymbol()).isEqualTo("RELIANCE");
        assertThat(series.size()).isEqualTo(3);
        assertThat(series.getBars()).extracting(PriceBar::date).containsExactly(
                LocalDate.of(2026, 10, 13), LocalDate.of(2026, 10, 14), LocalDate.of(2026, 10, 16));
        assertThat(series.lastClose()).isEqualTo(2950.4);
        assertThat(series.getBars().get(0).volume()).isEqualTo(1_200_000L);
    }

    @Test
    @DisplayName("Index symbols are requested without the exchange suffix")
    void indexTicker() {
        assertThat(provider.toTicker("^NSEI")).isEqualTo("^NSEI");
        assertThat(provider.toTicker("TCS")).isEqualTo("TCS.NS");
        assertThat(provider.toTicker("TCS.BO")).isEqualTo("TCS.BO");
    }

    @Nested
    @DisplayName("Error classification")
    class Errors {

        @Test
        @DisplayName("HTTP 404 is a permanent failure")
        void notFound() {
            server.expect(requestTo(startsWith(BASE))).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThatThrownBy(() -> provider.fetchDaily("NOPE", 90))
                    .isInstanceOf(ProviderFatalException.class)
                    .satisfies(e -> assertThat(((ProviderFatalException) e).getSymbol()).isEqualTo("NOPE"));
        }

        @Test
        @DisplayName("HTTP 5xx and 429 are transient")
        void serverErrors() {
            server.expect(requestTo(startsWith(BASE))).andRespond(withServerError());
            assertThatThrownBy(() -> provider.fetchDaily("TCS", 90))
                    .isInstanceOf(ProviderUnavailableException.class);

            server.reset();
            server.expect(requestTo(startsWith(BASE))).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
            assertThatThrownBy(() -> provider.fetchDaily("TCS", 90))
                    .isInstanceOf(ProviderUnavailableException.class);
        }

        @Test
        @DisplayName("Chart error 'Not Found' is permanent, other chart errors transient")
        void chartErrors() {
            String notFound = "{\"chart\": {\"result\": null, \"error\": {\"code\": \"Not Found\", "
                    + "\"description\": \"No data found, symbol may be delisted\"}}}";
            String other = "{\"chart\": {\"result\": null, \"error\": {\"code\": \"Internal\", "
                    + "\"description\": \"try later\"}}}";

            assertThatThrownBy(() -> provider.parse("GONE", notFound)).isInstanceOf(ProviderFatalException.class);
            assertThatThrownBy(() -> provider.parse("TCS", other)).isInstanceOf(ProviderUnavailableException.class);
        }

        @Test
        @DisplayName("Empty results and malformed payloads are classified")
        void emptyAndMalformed() {
            String empty = "{\"chart\": {\"result\": [{\"meta\": {}, \"indicators\": {\"quote\": [{}]}}], \"error\": null}}";

            assertThatThrownBy(() -> provider.parse("TCS", empty)).isInstanceOf(ProviderFatalException.class);
            assertThatThrownBy(() -> provider.parse("TCS", "<html>rate limited</html>"))
                    .isInstanceOf(ProviderUnavailableException.class);
        }
    }
}
