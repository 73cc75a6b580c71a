package com.swing.controller;

import com.swing.cache.CacheGeneration;
import com.swing.model.Snapshot;
import com.swing.service.BreadthSummary;
import com.swing.service.TopPicks;

import java.time.Instant;
import java.util.List;

import static com.swing.controller.Rounding.round;

/**
 * Body of {@code GET /api/stocks}.
 *
 * <p>{@code summary} and {@code topPicks} always describe the whole generation;
 * only {@code stocks} reflects the requested filter and order.
 */
public record StocksResponse(
        List<SnapshotView> stocks,
        NiftyView nifty,
        Summary summary,
        Picks topPicks,
        Instant fetchedAt,
        long generation,
        long nextRefresh,
        boolean stale,
        boolean refreshing,
        String dataSource
) {

    public record Summary(int longs, int shorts, int neutrals, int total,
                          double longPct, double shortPct, double neutralPct) {

        static Summary from(BreadthSummary breadth) {
            return new Summary(breadth.longs(), breadth.shorts(), breadth.neutrals(), breadth.total(),
                    round(breadth.longPct()), round(breadth.shortPct()), round(breadth.neutralPct()));
        }
    }

    public record Picks(SnapshotView topLong, SnapshotView topShort, List<SnapshotView> others) {

        static Picks from(TopPicks picks) {
            return new Picks(SnapshotView.from(picks.topLong()), SnapshotView.from(picks.topShort()),
                    picks.others().stream().map(SnapshotView::from).toList());
        }
    }

    public static StocksResponse of(CacheGeneration generation,
                                    List<Snapshot> stocks,
                                    BreadthSummary breadth,
                                    TopPicks picks,
                                    long nextRefresh,
                                    boolean stale,
                                    boolean refreshing,
                                    String dataSource) {
        return new StocksResponse(
                stocks.stream().map(SnapshotView::from).toList(),
                NiftyView.from(generation.index()),
                Summary.from(breadth),
                Picks.from(picks),
                generation.builtAt(),
                generation.sequence(),
                nextRefresh,
                stale,
                refreshing,
                dataSource
        );
    }
}
