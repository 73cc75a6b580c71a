package com.swing.indicator;

import com.swing.model.IndicatorSet;
import com.swing.model.PriceBar;
import com.swing.model.PriceSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IndicatorEngine")
class IndicatorEngineTest {

    private final IndicatorEngine engine = new IndicatorEngine();

    private static PriceSeries series(int bars) {
        List<PriceBar> list = new ArrayList<>();
        LocalDate start = LocalDate.of(2026, 6, 1);
        for (int i = 0; i < bars; i++) {
            double close = 500 + i * 2 + (i % 3 == 0 ? -3 : 1);
            list.add(new PriceBar(start.plusDays(i), close - 1, close + 4, close - 4, close, 1_000L));
        }
        return new PriceSeries("TEST", list);
    }

    @Test
    @DisplayName("Long history fills every indicator")
    void fullHistory() {
        IndicatorSet set = engine.compute(series(60));

        assertThat(set.isDegraded()).isFalse();
        assertThat(set.rsi()).isBetween(0.0, 100.0);
        assertThat(set.macd()).isNotNull();
        assertThat(set.macd().histogram()).isEqualTo(set.macd().line() - set.macd().signal());
        assertThat(set.sma20()).isNotNull();
        assertThat(set.ema9()).isGreaterThan(set.ema21());
        assertThat(set.atr14()).isPositive();
        assertThat(set.bollinger()).isNotNull();
        assertThat(set.bbPosition()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Twenty bars leave MACD and EMA21 unavailable, the rest computed")
    void twentyBars() {
        IndicatorSet set = engine.compute(series(20));

        assertThat(set.unavailable()).containsExactly("MACD", "EMA21");
        assertThat(set.macd()).isNull();
        assertThat(set.ema21()).isNull();
        assertThat(set.rsi()).isNotNull();
        assertThat(set.sma20()).isNotNull();
        assertThat(set.ema9()).isNotNull();
        assertThat(set.atr14()).isNotNull();
        assertThat(set.bollinger()).isNotNull();
    }

    @Test
    @DisplayName("Thirty bars keep the MACD line without signal or histogram")
    void macdLineOnly() {
        IndicatorSet set = engine.compute(series(30));

        assertThat(set.unavailable()).containsExactly("MACD_SIGNAL");
        assertThat(set.macd()).isNotNull();
        assertThat(set.macd().line()).isPositive();
        assertThat(set.macd().hasSignal()).isFalse();
        assertThat(set.macd().signal()).isNull();
        assertThat(set.macd().histogram()).isNull();
    }

    @Test
    @DisplayName("Ten bars keep only EMA9")
    void tenBars() {
        IndicatorSet set = engine.compute(series(10));

        assertThat(set.unavailable()).containsExactly("RSI", "MACD", "SMA20", "EMA21", "ATR", "BOLLINGER");
        assertThat(set.ema9()).isNotNull();
        assertThat(set.bbPosition()).isNull();
        assertThat(set.atrOrZero()).isZero();
    }

    @Test
    @DisplayName("A single bar degrades every indicator without throwing")
    void singleBar() {
        IndicatorSet set = engine.compute(series(1));

        assertThat(set.unavailable()).hasSize(7);
    }
}
