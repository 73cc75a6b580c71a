package com.swing.cache;

import com.swing.model.IndexSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UniverseCache")
class UniverseCacheTest {

    private static final Instant T0 = Instant.parse("2026-10-19T04:00:00Z");

    private MutableClock clock;
    private UniverseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        cache = new UniverseCache(120, clock);
    }

    private static CacheGeneration generation(long sequence, Instant builtAt) {
        return new CacheGeneration(sequence, Map.of(), IndexSnapshot.unavailable("^NSEI", builtAt),
                builtAt, 0, 0, List.of());
    }

    @Test
    @DisplayName("Starts empty and asks for a refresh")
    void startsEmpty() {
        assertThat(cache.state()).isEqualTo(CacheState.EMPTY);
        assertThat(cache.current()).isEmpty();
        assertThat(cache.age()).isEmpty();
        assertThat(cache.needsRefresh()).isTrue();
        assertThat(cache.secondsUntilStale()).isZero();
    }

    @Test
    @DisplayName("Fresh until the TTL elapses, stale from then on")
    void ttlBoundary() {
        cache.publish(generation(1, T0));

        assertThat(cache.state()).isEqualTo(CacheState.FRESH);
        assertThat(cache.needsRefresh()).isFalse();

        clock.advance(Duration.ofSeconds(119));
        assertThat(cache.state()).isEqualTo(CacheState.FRESH);
        assertThat(cache.secondsUntilStale()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.state()).isEqualTo(CacheState.STALE);
        assertThat(cache.needsRefresh()).isTrue();
        assertThat(cache.secondsUntilStale()).isZero();
        assertThat(cache.current()).isPresent();
    }

    @Test
    @DisplayName("Publishing swaps the whole generation")
    void publishReplaces() {
        CacheGeneration first = generation(1, T0);
        cache.publish(first);
        clock.advance(Duration.ofSeconds(300));

        CacheGeneration second = generation(2, clock.instant());
        cache.publish(second);

        assertThat(cache.current()).containsSame(second);
        assertThat(cache.state()).isEqualTo(CacheState.FRESH);
        assertThat(cache.age()).contains(Duration.ZERO);
    }

    @Test
    @DisplayName("Non-positive TTL is rejected")
    void invalidTtl() {
        assertThatThrownBy(() -> new UniverseCache(0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
