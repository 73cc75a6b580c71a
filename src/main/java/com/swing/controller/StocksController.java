package com.swing.controller;

import com.swing.cache.CacheGeneration;
import com.swing.cache.CacheState;
import com.swing.cache.UniverseCache;
import com.swing.cache.UniverseRefresher;
import com.swing.model.Direction;
import com.swing.model.Snapshot;
import com.swing.service.SignalAggregator;
import com.swing.service.SortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Signal read API.
 *
 * <pre>
 * GET /api/stocks?direction=LONG&amp;sector=IT&amp;sort=confidence
 * GET /api/stock/RELIANCE
 * </pre>
 *
 * Reads never wait for data: a stale generation is served as is while a refresh runs
 * in the background, and an empty cache answers 503 until the first one lands.
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class StocksController {

    private static final Logger log = LoggerFactory.getLogger(StocksController.class);

    private final UniverseRefresher refresher;
    private final UniverseCache cache;
    private final SignalAggregator aggregator;
    private final String dataSourceLabel;

    public StocksController(UniverseRefresher refresher,
                            UniverseCache cache,
                            SignalAggregator aggregator,
                            @Value("${swing.api.data-source:}") String dataSourceLabel) {
        this.refresher = refresher;
        this.cache = cache;
        this.aggregator = aggregator;
        this.dataSourceLabel = dataSourceLabel;
    }

    /**
     * All snapshots of the current generation.
     *
     * @param direction LONG, SHORT, NEUTRAL or ALL (default)
     * @param sector    sector label, case-insensitive
     * @param sort      confidence (default), score, change, rsi or symbol
     */
    @GetMapping("/stocks")
    public ResponseEntity<?> getStocks(
            @RequestParam(required = false) String direction,
            @RequestParam(required = false) String sector,
            @RequestParam(defaultValue = "confidence") String sort
    ) {
        Direction wanted = null;
        if (direction != null && !direction.isBlank() && !"ALL".equalsIgnoreCase(direction.trim())) {
            Optional<Direction> parsed = Direction.fromName(direction);
            if (parsed.isEmpty()) {
                log.warn("Invalid direction requested: {}", direction);
                return ResponseEntity.badRequest()
                        .body(ErrorResponse.of("Unsupported direction: " + direction
                                + ". Supported: LONG, SHORT, NEUTRAL, ALL"));
            }
            wanted = parsed.get();
        }

        Optional<SortKey> sortKey = SortKey.fromLabel(sort);
        if (sortKey.isEmpty()) {
            log.warn("Invalid sort requested: {}", sort);
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of("Unsupported sort: " + sort
                            + ". Supported: " + String.join(", ", SortKey.supportedLabels())));
        }

        Optional<CacheGeneration> current = refresher.read();
        if (current.isEmpty()) {
            return warmingUp();
        }

        CacheGeneration generation = current.get();
        List<Snapshot> stocks = aggregator.view(generation, wanted, sector, sortKey.get());
        boolean stale = cache.state() == CacheState.STALE;
        long nextRefresh = Math.max(1L, cache.secondsUntilStale());

        log.debug("Stocks request: direction={} sector={} sort={} -> {} of {} (generation #{})",
                direction, sector, sort, stocks.size(), generation.size(), generation.sequence());
        return ResponseEntity.ok(StocksResponse.of(generation, stocks,
                aggregator.summarize(generation), aggregator.topPicks(generation),
                nextRefresh, stale, refresher.isRefreshing(), dataSource()));
    }

    /**
     * One symbol from the current generation, case-insensitive.
     */
    @GetMapping("/stock/{symbol}")
    public ResponseEntity<?> getStock(@PathVariable String symbol) {
        Optional<CacheGeneration> current = refresher.read();
        if (current.isEmpty()) {
            return warmingUp();
        }

        Optional<Snapshot> snapshot = current.get().find(symbol);
        if (snapshot.isEmpty()) {
            log.debug("Symbol not in current generation: {}", symbol);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of("Symbol " + symbol + " not found"));
        }
        return ResponseEntity.ok(SnapshotView.from(snapshot.get()));
    }

    private ResponseEntity<ErrorResponse> warmingUp() {
        String message = refresher.status().failedRefreshCount() == 0
                ? "Fetching data for the first time, please retry in 30 seconds"
                : "Data source unavailable, retrying. Please retry in 30 seconds";
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.warmingUp(message));
    }

    private String dataSource() {
        return dataSourceLabel == null || dataSourceLabel.isBlank() ? refresher.dataSource() : dataSourceLabel;
    }
}
