package com.swing.provider;

import com.swing.model.PriceBar;
import com.swing.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offline market data: a seeded random walk per symbol over weekday sessions.
 *
 * <p>Enabled with {@code swing.provider.type=synthetic}. The walk depends only on the
 * seed, the symbol and the requested window, so repeated fetches on the same day
 * return identical series. Each symbol gets its own base price and drift so the
 * universe produces a mix of directions.
 */
@Component
@ConditionalOnProperty(name = "swing.provider.type", havingValue = "synthetic")
public class SyntheticMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(SyntheticMarketDataProvider.class);

    private final Clock clock;
    private final ZoneId zone;
    private final long seed;
    private final AtomicLong fetchCount = new AtomicLong(0);

    public SyntheticMarketDataProvider(
            Clock clock,
            @Value("${swing.market.zone:Asia/Kolkata}") ZoneId zone,
            @Value("${swing.provider.synthetic.seed:42}") long seed) {
        this.clock = clock;
        this.zone = zone;
        this.seed = seed;
        log.info("SyntheticMarketDataProvider initialized with seed={}", seed);
    }

    @Override
    public PriceSeries fetchDaily(String symbol, int days) {
        LocalDate end = LocalDate.now(clock.withZone(zone));
        List<LocalDate> sessions = new ArrayList<>();
        for (LocalDate d = end.minusDays(days - 1L); !d.isAfter(end); d = d.plusDays(1)) {
            if (d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY) {
                sessions.add(d);
            }
        }

        Random random = new Random(seed ^ symbol.hashCode());
        double price = 100.0 + random.nextInt(4900);
        // Drift between -0.4% and +0.4% per session
        double drift = (random.nextDouble() - 0.5) * 0.008;

        List<PriceBar> bars = new ArrayList<>(sessions.size());
        for (LocalDate date : sessions) {
            double open = price;
            double close = Math.max(0.01, open * (1 + drift + random.nextGaussian() * 0.01));
            double high = Math.max(open, close) * (1 + Math.abs(random.nextGaussian()) * 0.004);
            double low = Math.min(open, close) * (1 - Math.abs(random.nextGaussian()) * 0.004);
            bars.add(new PriceBar(date, open, high, low, close, 100_000L + random.nextInt(900_000)));
            price = close;
        }

        long count = fetchCount.incrementAndGet();
        if (count % 500 == 0) {
            log.info("Generated {} synthetic series so far", count);
        }
        return new PriceSeries(symbol, bars);
    }

    @Override
    public String description() {
        return "Synthetic random walk (seed " + seed + ")";
    }

    public long getFetchCount() {
        return fetchCount.get();
    }
}
