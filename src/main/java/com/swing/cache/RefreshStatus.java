package com.swing.cache;

import java.time.Instant;

/**
 * Point-in-time view of the refresher for health reporting.
 *
 * @param state              Cache state, REFRESHING while a pass is in flight
 * @param refreshing         Whether a pass is in flight
 * @param lastAttemptAt      Start of the most recent pass, null if none ran yet
 * @param lastSuccessAt      Start of the most recent successful pass
 * @param lastError          Message of the most recent failed pass, cleared on success
 * @param refreshCount       Successful passes since startup
 * @param failedRefreshCount Failed passes since startup
 */
public record RefreshStatus(
        CacheState state,
        boolean refreshing,
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        String lastError,
        long refreshCount,
        long failedRefreshCount
) {}
