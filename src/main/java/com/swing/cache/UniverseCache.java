package com.swing.cache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link CacheGeneration}.
 *
 * <p>Reads are a single volatile load and never block. A new generation replaces the
 * old one in one atomic swap, so a reader sees either generation in full. Only
 * {@link UniverseRefresher} publishes.
 */
@Component
public class UniverseCache {

    private final AtomicReference<CacheGeneration> current = new AtomicReference<>();
    private final Duration ttl;
    private final Clock clock;

    public UniverseCache(@Value("${swing.cache.ttl-seconds:120}") long ttlSeconds, Clock clock) {
        if (ttlSeconds <= 0) throw new IllegalArgumentException("TTL must be positive");
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.clock = clock;
    }

    public Optional<CacheGeneration> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * EMPTY, FRESH or STALE; REFRESHING is layered on by the refresher.
     */
    public CacheState state() {
        CacheGeneration generation = current.get();
        if (generation == null) return CacheState.EMPTY;
        return age(generation).compareTo(ttl) >= 0 ? CacheState.STALE : CacheState.FRESH;
    }

    public boolean needsRefresh() {
        return state() != CacheState.FRESH;
    }

    /**
     * Age of the current generation, empty before the first publish.
     */
    public Optional<Duration> age() {
        return current().map(this::age);
    }

    /**
     * Seconds until the current generation turns stale; 0 when it already is or none exists.
     */
    public long secondsUntilStale() {
        return age().map(a -> Math.max(0L, ttl.minus(a).getSeconds())).orElse(0L);
    }

    public Duration getTtl() {
        return ttl;
    }

    void publish(CacheGeneration generation) {
        current.set(generation);
    }

    private Duration age(CacheGeneration generation) {
        Duration age = Duration.between(generation.builtAt(), Instant.now(clock));
        return age.isNegative() ? Duration.ZERO : age;
    }
}
