package com.swing.service;

import com.swing.model.Snapshot;

import java.util.List;

/**
 * Highlighted names for the dashboard header.
 *
 * @param topLong  highest-confidence LONG, null when there is none
 * @param topShort highest-confidence SHORT, null when there is none
 * @param others   next strongest directional names, at most {@link SignalAggregator#OTHER_PICKS}
 */
public record TopPicks(Snapshot topLong, Snapshot topShort, List<Snapshot> others) {

    public TopPicks {
        others = others == null ? List.of() : List.copyOf(others);
    }
}
