package com.swing.controller;

import java.time.Instant;

/**
 * Body of {@code GET /api/health}. {@code cacheAge} and {@code builtAt} are null
 * until the first generation is published.
 */
public record HealthResponse(
        String status,
        String state,
        Long cacheAge,
        Instant builtAt,
        int stocksCached,
        int universeSize,
        boolean fetching,
        long ttlSeconds,
        Instant lastRefreshAt,
        String lastError,
        long refreshCount,
        long failedRefreshCount
) {}
