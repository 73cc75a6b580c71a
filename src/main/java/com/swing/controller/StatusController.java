package com.swing.controller;

import com.swing.cache.CacheGeneration;
import com.swing.cache.RefreshStatus;
import com.swing.cache.UniverseCache;
import com.swing.cache.UniverseRefresher;
import com.swing.model.UniverseEntry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operational endpoints for health monitoring and service introspection.
 * None of them trigger a refresh.
 */
@RestController
@CrossOrigin(origins = "*")
public class StatusController {

    private final UniverseRefresher refresher;
    private final UniverseCache cache;

    public StatusController(UniverseRefresher refresher, UniverseCache cache) {
        this.refresher = refresher;
        this.cache = cache;
    }

    /**
     * Liveness probe.
     * GET / → {"status": "ok", "message": "..."}
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("status", "ok", "message", "Swing Signal API"));
    }

    /**
     * Cache and refresher state.
     * GET /api/health → state, cache age, counters, last error
     */
    @GetMapping("/api/health")
    public ResponseEntity<HealthResponse> health() {
        RefreshStatus status = refresher.status();
        Optional<CacheGeneration> current = cache.current();
        return ResponseEntity.ok(new HealthResponse(
                "healthy",
                status.state().name(),
                cache.age().map(Duration::getSeconds).orElse(null),
                current.map(CacheGeneration::builtAt).orElse(null),
                current.map(CacheGeneration::size).orElse(0),
                refresher.getUniverse().size(),
                status.refreshing(),
                cache.getTtl().getSeconds(),
                status.lastAttemptAt(),
                status.lastError(),
                status.refreshCount(),
                status.failedRefreshCount()
        ));
    }

    /**
     * Configured universe.
     * GET /api/universe → [{"symbol": "RELIANCE", "sector": "Energy"}, ...]
     */
    @GetMapping("/api/universe")
    public ResponseEntity<List<UniverseEntry>> universe() {
        return ResponseEntity.ok(refresher.getUniverse().getEntries());
    }
}
