package com.swing.indicator;

import com.swing.model.BollingerBands;
import com.swing.model.IndicatorSet;
import com.swing.model.MacdValue;
import com.swing.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Computes the full {@link IndicatorSet} for one price series.
 *
 * <p>Each indicator is computed independently: a series too short for one of them
 * leaves that field null and records its name, the others are still filled in.
 * MACD degrades in two steps: a series long enough for the line but not the signal
 * keeps the line and records {@code MACD_SIGNAL}.
 */
@Component
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    public IndicatorSet compute(PriceSeries series) {
        double[] closes = series.closes();
        double[] highs = series.highs();
        double[] lows = series.lows();
        List<String> unavailable = new ArrayList<>();

        Double rsi = attempt("RSI", unavailable,
                () -> Indicators.last(Indicators.rsi(closes, Indicators.RSI_PERIOD)));
        MacdValue macd = attempt("MACD", unavailable, () -> {
            Indicators.MacdSeries m = Indicators.macd(closes,
                    Indicators.MACD_FAST, Indicators.MACD_SLOW, Indicators.MACD_SIGNAL);
            if (!m.hasSignal()) {
                return MacdValue.lineOnly(Indicators.last(m.line()));
            }
            return new MacdValue(Indicators.last(m.line()), Indicators.last(m.signal()), Indicators.last(m.histogram()));
        });
        if (macd != null && !macd.hasSignal()) {
            unavailable.add("MACD_SIGNAL");
        }
        Double sma20 = attempt("SMA20", unavailable,
                () -> Indicators.last(Indicators.sma(closes, Indicators.SMA_PERIOD)));
        Double ema9 = attempt("EMA9", unavailable,
                () -> Indicators.last(Indicators.ema(closes, Indicators.EMA_FAST)));
        Double ema21 = attempt("EMA21", unavailable,
                () -> Indicators.last(Indicators.ema(closes, Indicators.EMA_SLOW)));
        Double atr = attempt("ATR", unavailable,
                () -> Indicators.last(Indicators.atr(highs, lows, closes, Indicators.ATR_PERIOD)));
        BollingerBands bands = attempt("BOLLINGER", unavailable,
                () -> Indicators.bollinger(closes, Indicators.BOLLINGER_PERIOD, Indicators.BOLLINGER_K));

        Double bbPosition = null;
        if (bands != null && closes.length > 0) {
            bbPosition = bands.position(closes[closes.length - 1]);
        }

        if (!unavailable.isEmpty()) {
            log.debug("[{}] Degraded indicators {} with {} bars", series.getSymbol(), unavailable, series.size());
        }
        return new IndicatorSet(rsi, macd, sma20, ema9, ema21, atr, bands, bbPosition, unavailable);
    }

    private static <T> T attempt(String name, List<String> unavailable, Supplier<T> computation) {
        try {
            return computation.get();
        } catch (InsufficientHistoryException e) {
            unavailable.add(name);
            return null;
        }
    }
}
