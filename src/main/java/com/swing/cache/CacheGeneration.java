package com.swing.cache;

import com.swing.model.IndexSnapshot;
import com.swing.model.Snapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One complete, immutable result set for the universe.
 *
 * @param sequence     Monotonic generation number, starting at 1
 * @param snapshots    Snapshots keyed by symbol, in universe order
 * @param index        Index reference level
 * @param builtAt      Time the refresh that produced this generation started
 * @param freshCount   Snapshots computed from data fetched in this refresh
 * @param carriedCount Snapshots carried over from the previous generation
 * @param omitted      Symbols with no snapshot in this generation
 */
public record CacheGeneration(
        long sequence,
        Map<String, Snapshot> snapshots,
        IndexSnapshot index,
        Instant builtAt,
        int freshCount,
        int carriedCount,
        List<String> omitted
) {

    public CacheGeneration {
        snapshots = Collections.unmodifiableMap(new LinkedHashMap<>(snapshots));
        omitted = omitted == null ? List.of() : List.copyOf(omitted);
    }

    public Collection<Snapshot> all() {
        return snapshots.values();
    }

    public Optional<Snapshot> find(String symbol) {
        if (symbol == null) return Optional.empty();
        return Optional.ofNullable(snapshots.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    public int size() {
        return snapshots.size();
    }
}
