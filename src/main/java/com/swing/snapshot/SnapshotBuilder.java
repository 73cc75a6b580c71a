package com.swing.snapshot;

import com.swing.indicator.IndicatorEngine;
import com.swing.indicator.InsufficientHistoryException;
import com.swing.model.IndicatorSet;
import com.swing.model.PriceSeries;
import com.swing.model.Signal;
import com.swing.model.Snapshot;
import com.swing.model.UniverseEntry;
import com.swing.scoring.ScoringEngine;
import com.swing.strategy.ExpiryCalendar;
import com.swing.strategy.OptionStrategy;
import com.swing.strategy.StrategySelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Runs indicators, scoring and strategy selection for one symbol and packs the
 * result into an immutable {@link Snapshot} stamped with the refresh time.
 */
@Component
public class SnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBuilder.class);

    /** Closes kept for the dashboard sparkline. */
    public static final int HISTORY_POINTS = 60;

    private final IndicatorEngine indicatorEngine;
    private final ScoringEngine scoringEngine;
    private final StrategySelector strategySelector;
    private final ZoneId marketZone;

    public SnapshotBuilder(IndicatorEngine indicatorEngine,
                           ScoringEngine scoringEngine,
                           StrategySelector strategySelector,
                           @Value("${swing.market.zone:Asia/Kolkata}") ZoneId marketZone) {
        this.indicatorEngine = indicatorEngine;
        this.scoringEngine = scoringEngine;
        this.strategySelector = strategySelector;
        this.marketZone = marketZone;
    }

    /**
     * @param entry  universe entry (symbol and sector)
     * @param series price history, oldest first
     * @param asOf   build time shared by the whole refresh
     * @throws InsufficientHistoryException if the series is missing or empty
     */
    public Snapshot build(UniverseEntry entry, PriceSeries series, Instant asOf) {
        if (series == null || series.isEmpty()) {
            throw new InsufficientHistoryException("PRICE", 1, 0);
        }

        double[] closes = series.closes();
        double price = closes[closes.length - 1];

        IndicatorSet indicators = indicatorEngine.compute(series);
        Signal signal = scoringEngine.score(indicators, price);

        LocalDate expiry = ExpiryCalendar.nextWeeklyExpiry(asOf.atZone(marketZone).toLocalDate());
        OptionStrategy strategy = strategySelector.select(entry.symbol(), signal.direction(), signal.confidence(),
                price, indicators.atrOrZero(), expiry);

        List<Double> history = series.tailCloses(HISTORY_POINTS);

        log.debug("[{}] price={} score={} direction={} confidence={} strategy={}",
                entry.symbol(), price, signal.score(), signal.direction(), signal.confidence(),
                strategy.name().getLabel());

        return new Snapshot(entry.symbol(), entry.sector(), price,
                percentChange(closes, 1), percentChange(closes, 5),
                history, indicators, signal, strategy, asOf, false);
    }

    /**
     * Percent change of the last close versus the close {@code lookback} bars earlier;
     * 0 when the series is not long enough.
     */
    static double percentChange(double[] closes, int lookback) {
        if (closes.length <= lookback) return 0.0;
        double then = closes[closes.length - 1 - lookback];
        if (then == 0) return 0.0;
        return (closes[closes.length - 1] - then) / then * 100.0;
    }
}
