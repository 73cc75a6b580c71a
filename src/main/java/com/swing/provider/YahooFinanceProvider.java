package com.swing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swing.model.PriceBar;
import com.swing.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily bars from the Yahoo Finance v8 chart endpoint (free, delayed).
 *
 * <pre>
 * GET {base}/v8/finance/chart/RELIANCE.NS?period1=..&amp;period2=..&amp;interval=1d
 * </pre>
 *
 * Symbols get the exchange suffix appended unless they are index symbols starting
 * with {@code ^}. Rows with a missing close are dropped.
 */
@Component
@ConditionalOnProperty(name = "swing.provider.type", havingValue = "yahoo", matchIfMissing = true)
public class YahooFinanceProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooFinanceProvider.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String baseUrl;
    private final String symbolSuffix;
    private final String userAgent;
    private final ZoneId fallbackZone;

    public YahooFinanceProvider(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${swing.provider.yahoo.base-url:https://query1.finance.yahoo.com}") String baseUrl,
            @Value("${swing.provider.yahoo.symbol-suffix:.NS}") String symbolSuffix,
            @Value("${swing.provider.yahoo.user-agent:Mozilla/5.0 (swing-signal-service)}") String userAgent,
            @Value("${swing.market.zone:Asia/Kolkata}") ZoneId fallbackZone) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.baseUrl = baseUrl;
        this.symbolSuffix = symbolSuffix;
        this.userAgent = userAgent;
        this.fallbackZone = fallbackZone;
    }

    @Override
    public PriceSeries fetchDaily(String symbol, int days) {
        String ticker = toTicker(symbol);
        long period2 = Instant.now(clock).getEpochSecond();
        long period1 = period2 - days * 86_400L;
        String url = baseUrl + "/v8/finance/chart/{ticker}?period1={p1}&period2={p2}&interval=1d&events=history";

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers),
                    String.class, Map.of("ticker", ticker, "p1", period1, "p2", period2));
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            throw classify(symbol, e);
        } catch (ResourceAccessException e) {
            throw new ProviderUnavailableException(symbol, "Yahoo unreachable for " + ticker + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(symbol, "Yahoo request failed for " + ticker + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new ProviderUnavailableException(symbol, "Empty response from Yahoo for " + ticker);
        }
        PriceSeries series = parse(symbol, body);
        log.debug("Fetched {} bars for {} ({})", series.size(), symbol, ticker);
        return series;
    }

    @Override
    public String description() {
        return "Yahoo Finance (NSE ~15min delayed)";
    }

    String toTicker(String symbol) {
        if (symbol.startsWith("^") || symbol.contains(".")) return symbol;
        return symbol + symbolSuffix;
    }

    PriceSeries parse(String symbol, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ProviderUnavailableException(symbol, "Malformed Yahoo payload for " + symbol, e);
        }

        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String code = error.path("code").asText("");
            String description = error.path("description").asText("");
            if ("Not Found".equalsIgnoreCase(code)) {
                throw new ProviderFatalException(symbol, "Unknown symbol " + symbol + ": " + description);
            }
            throw new ProviderUnavailableException(symbol, "Yahoo error for " + symbol + ": " + code + " " + description);
        }

        JsonNode result = chart.path("result").path(0);
        JsonNode timestamps = result.path("timestamp");
        if (result.isMissingNode() || !timestamps.isArray() || timestamps.isEmpty()) {
            throw new ProviderFatalException(symbol, "No price history returned for " + symbol);
        }

        ZoneId zone = resolveZone(result.path("meta").path("exchangeTimezoneName").asText(null));
        JsonNode quote = result.path("indicators").path("quote").path(0);
        JsonNode opens = quote.path("open");
        JsonNode highs = quote.path("high");
        JsonNode lows = quote.path("low");
        JsonNode closes = quote.path("close");
        JsonNode volumes = quote.path("volume");

        // Keyed by date: the live session can repeat the last day's date
        TreeMap<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode close = closes.path(i);
            if (!close.isNumber() || close.asDouble() <= 0) continue;
            double c = close.asDouble();
            double h = highs.path(i).isNumber() ? highs.path(i).asDouble() : c;
            double l = lows.path(i).isNumber() ? lows.path(i).asDouble() : c;
            double o = opens.path(i).isNumber() ? opens.path(i).asDouble() : c;
            long v = volumes.path(i).isNumber() ? volumes.path(i).asLong() : 0L;
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            byDate.put(date, new PriceBar(date, o, Math.max(h, Math.max(l, c)), Math.min(l, Math.min(h, c)), c, Math.max(0L, v)));
        }

        if (byDate.isEmpty()) {
            throw new ProviderFatalException(symbol, "No usable closes returned for " + symbol);
        }
        return new PriceSeries(symbol, new ArrayList<>(byDate.values()));
    }

    private ZoneId resolveZone(String name) {
        if (name == null || name.isBlank()) return fallbackZone;
        try {
            return ZoneId.of(name);
        } catch (RuntimeException e) {
            log.debug("Unknown exchange zone {}, using {}", name, fallbackZone);
            return fallbackZone;
        }
    }

    private static RuntimeException classify(String symbol, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.NOT_FOUND.value() || status == HttpStatus.BAD_REQUEST.value()) {
            return new ProviderFatalException(symbol, "Yahoo rejected " + symbol + " with HTTP " + status, e);
        }
        return new ProviderUnavailableException(symbol, "Yahoo returned HTTP " + status + " for " + symbol, e);
    }
}
