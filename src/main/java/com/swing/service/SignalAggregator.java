package com.swing.service;

import com.swing.cache.CacheGeneration;
import com.swing.model.Direction;
import com.swing.model.Snapshot;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-side views over a {@link CacheGeneration}: market breadth, top picks and
 * filtered, sorted listings. Stateless; every call works on the generation it is given.
 */
@Service
public class SignalAggregator {

    public static final int OTHER_PICKS = 2;

    private static final Comparator<Snapshot> BY_STRENGTH = SortKey.CONFIDENCE.comparator();

    public BreadthSummary summarize(CacheGeneration generation) {
        int longs = 0;
        int shorts = 0;
        int neutrals = 0;
        for (Snapshot snapshot : generation.all()) {
            switch (snapshot.direction()) {
                case LONG:
                    longs++;
                    break;
                case SHORT:
                    shorts++;
                    break;
                default:
                    neutrals++;
                    break;
            }
        }
        return BreadthSummary.of(longs, shorts, neutrals);
    }

    public TopPicks topPicks(CacheGeneration generation) {
        Collection<Snapshot> all = generation.all();
        Snapshot topLong = strongest(all, Direction.LONG).orElse(null);
        Snapshot topShort = strongest(all, Direction.SHORT).orElse(null);

        List<Snapshot> others = all.stream()
                .filter(s -> s.direction() != Direction.NEUTRAL)
                .filter(s -> s != topLong && s != topShort)
                .sorted(BY_STRENGTH)
                .limit(OTHER_PICKS)
                .toList();
        return new TopPicks(topLong, topShort, others);
    }

    /**
     * @param direction only this direction, or all when null
     * @param sector    only this sector (case-insensitive), or all when null/blank
     * @param sort      ordering of the result
     */
    public List<Snapshot> view(CacheGeneration generation, Direction direction, String sector, SortKey sort) {
        return generation.all().stream()
                .filter(s -> direction == null || s.direction() == direction)
                .filter(s -> sector == null || sector.isBlank() || s.sector().equalsIgnoreCase(sector.trim()))
                .sorted(sort.comparator())
                .toList();
    }

    private static Optional<Snapshot> strongest(Collection<Snapshot> snapshots, Direction direction) {
        return snapshots.stream()
                .filter(s -> s.direction() == direction)
                .min(BY_STRENGTH);
    }
}
