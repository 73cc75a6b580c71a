package com.swing.indicator;

import com.swing.model.BollingerBands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Indicators")
class IndicatorsTest {

    /** Deterministic zig-zag with an upward bias, long enough for every indicator. */
    private static double[] wavySeries(int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = 100.0 + i * 0.3 + Math.sin(i * 0.7) * 4.0;
        }
        return out;
    }

    private static double[] ramp(int n, double start, double step) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = start + i * step;
        return out;
    }

    static IntStream macdLengths() {
        return IntStream.rangeClosed(26, 90);
    }

    @Nested
    @DisplayName("Moving averages")
    class MovingAverages {

        @Test
        @DisplayName("SMA is undefined before the window fills and exact afterwards")
        void smaWindow() {
            double[] sma = Indicators.sma(new double[]{1, 2, 3, 4, 5}, 3);

            assertThat(sma[0]).isNaN();
            assertThat(sma[1]).isNaN();
            assertThat(sma[2]).isEqualTo(2.0);
            assertThat(sma[4]).isEqualTo(4.0);
        }

        @Test
        @DisplayName("EMA is seeded with the SMA of the first window")
        void emaSeededWithSma() {
            double[] ema = Indicators.ema(ramp(10, 1, 1), 3);

            assertThat(ema[1]).isNaN();
            assertThat(ema[2]).isEqualTo(2.0);
            assertThat(ema[3]).isEqualTo(3.0);
            // A linear ramp keeps a constant lag of (period - 1) / 2
            assertThat(Indicators.last(ema)).isCloseTo(9.0, within(1e-9));
        }

        @Test
        @DisplayName("EMA skips leading NaNs")
        void emaSkipsLeadingNaN() {
            double[] values = {Double.NaN, Double.NaN, 2, 4, 6};
            double[] ema = Indicators.ema(values, 3);

            assertThat(ema[3]).isNaN();
            assertThat(ema[4]).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Short input throws InsufficientHistoryException")
        void shortInput() {
            assertThatThrownBy(() -> Indicators.sma(new double[]{1, 2}, 3))
                    .isInstanceOf(InsufficientHistoryException.class);
            assertThatThrownBy(() -> Indicators.ema(new double[]{Double.NaN, 1, 2}, 3))
                    .isInstanceOf(InsufficientHistoryException.class);
        }
    }

    @Nested
    @DisplayName("RSI")
    class Rsi {

        @Test
        @DisplayName("Balanced gains and losses give 50, then Wilder smoothing applies")
        void wilderSmoothing() {
            double[] closes = new double[16];
            closes[0] = 100;
            for (int i = 1; i <= 14; i++) {
                closes[i] = closes[i - 1] + (i % 2 == 1 ? 1 : -1);
            }
            closes[15] = closes[14] + 2;

            double[] rsi = Indicators.rsi(closes, 14);

            assertThat(rsi[13]).isNaN();
            assertThat(rsi[14]).isCloseTo(50.0, within(1e-9));
            // avgGain = (0.5 * 13 + 2) / 14, avgLoss = 0.5 * 13 / 14
            assertThat(rsi[15]).isCloseTo(100.0 * 8.5 / 15.0, within(1e-9));
        }

        @Test
        @DisplayName("Only gains give 100, only losses give 0")
        void extremes() {
            assertThat(Indicators.last(Indicators.rsi(ramp(20, 100, 1), 14))).isEqualTo(100.0);
            assertThat(Indicators.last(Indicators.rsi(ramp(20, 100, -1), 14))).isEqualTo(0.0);
        }

        @ParameterizedTest(name = "scale factor {0}")
        @ValueSource(doubles = {0.01, 3.0, 250.0})
        @DisplayName("RSI is invariant under scaling all prices")
        void scaleInvariant(double factor) {
            double[] closes = wavySeries(60);
            double[] scaled = new double[closes.length];
            for (int i = 0; i < closes.length; i++) scaled[i] = closes[i] * factor;

            assertThat(Indicators.last(Indicators.rsi(scaled, 14)))
                    .isCloseTo(Indicators.last(Indicators.rsi(closes, 14)), within(1e-9));
        }

        @Test
        @DisplayName("Needs period + 1 closes")
        void needsPeriodPlusOne() {
            assertThatThrownBy(() -> Indicators.rsi(ramp(14, 100, 1), 14))
                    .isInstanceOf(InsufficientHistoryException.class)
                    .satisfies(e -> {
                        InsufficientHistoryException ex = (InsufficientHistoryException) e;
                        assertThat(ex.getRequired()).isEqualTo(15);
                        assertThat(ex.getAvailable()).isEqualTo(14);
                    });
            assertThat(Indicators.rsi(ramp(15, 100, 1), 14)[14]).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("MACD")
    class Macd {

        @ParameterizedTest(name = "{0} closes")
        @MethodSource("com.swing.indicator.IndicatorsTest#macdLengths")
        @DisplayName("Histogram equals line minus signal wherever both are defined")
        void histogramIdentity(int length) {
            Indicators.MacdSeries macd = Indicators.macd(wavySeries(length), 12, 26, 9);

            int defined = 0;
            for (int i = 0; i < length; i++) {
                if (Double.isNaN(macd.line()[i]) || Double.isNaN(macd.signal()[i])) {
                    assertThat(macd.histogram()[i]).isNaN();
                    continue;
                }
                assertThat(macd.histogram()[i]).isEqualTo(macd.line()[i] - macd.signal()[i]);
                defined++;
            }
            assertThat(defined).isEqualTo(Math.max(0, length - 33));
        }

        @Test
        @DisplayName("Line starts at index slow - 1, signal at slow + signal - 2")
        void alignment() {
            Indicators.MacdSeries macd = Indicators.macd(wavySeries(40), 12, 26, 9);

            assertThat(macd.line()[24]).isNaN();
            assertThat(macd.line()[25]).isNotNaN();
            assertThat(macd.signal()[32]).isNaN();
            assertThat(macd.signal()[33]).isNotNaN();
        }

        @Test
        @DisplayName("Needs 26 closes for the line")
        void lineBoundary() {
            assertThatThrownBy(() -> Indicators.macd(wavySeries(25), 12, 26, 9))
                    .isInstanceOfSatisfying(InsufficientHistoryException.class, ex -> {
                        assertThat(ex.getRequired()).isEqualTo(26);
                        assertThat(ex.getAvailable()).isEqualTo(25);
                    });

            Indicators.MacdSeries macd = Indicators.macd(wavySeries(26), 12, 26, 9);
            assertThat(Indicators.last(macd.line())).isNotNaN();
            assertThat(macd.hasSignal()).isFalse();
        }

        @Test
        @DisplayName("33 closes give a line only, 34 closes the first signal and histogram")
        void signalBoundary() {
            Indicators.MacdSeries lineOnly = Indicators.macd(wavySeries(33), 12, 26, 9);
            assertThat(Indicators.last(lineOnly.line())).isNotNaN();
            assertThat(Arrays.stream(lineOnly.signal()).allMatch(Double::isNaN)).isTrue();
            assertThat(Arrays.stream(lineOnly.histogram()).allMatch(Double::isNaN)).isTrue();

            Indicators.MacdSeries full = Indicators.macd(wavySeries(34), 12, 26, 9);
            assertThat(full.hasSignal()).isTrue();
            assertThat(Indicators.last(full.histogram())).isNotNaN();
        }

        @Test
        @DisplayName("Rising prices give a positive MACD line")
        void risingIsPositive() {
            Indicators.MacdSeries macd = Indicators.macd(ramp(60, 100, 1), 12, 26, 9);
            assertThat(Indicators.last(macd.line())).isPositive();
        }
    }

    @Nested
    @DisplayName("Bollinger bands and ATR")
    class BandsAndRange {

        @Test
        @DisplayName("Bands use the sample standard deviation of the trailing window")
        void sampleStdev() {
            BollingerBands bands = Indicators.bollinger(new double[]{10, 1, 2, 3, 4, 5}, 5, 2.0);
            double std = Math.sqrt(2.5);

            assertThat(bands.mid()).isEqualTo(3.0);
            assertThat(bands.upper()).isCloseTo(3.0 + 2 * std, within(1e-9));
            assertThat(bands.lower()).isCloseTo(3.0 - 2 * std, within(1e-9));
        }

        @Test
        @DisplayName("Flat prices collapse the bands and position reports 0.5")
        void flatPrices() {
            double[] flat = new double[25];
            Arrays.fill(flat, 250.0);
            BollingerBands bands = Indicators.bollinger(flat, 20, 2.0);

            assertThat(bands.width()).isZero();
            assertThat(bands.position(250.0)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("True range includes gaps from the previous close")
        void trueRangeGap() {
            assertThat(Indicators.trueRange(12, 11, 9)).isEqualTo(3.0);
            assertThat(Indicators.trueRange(12, 10, 11)).isEqualTo(2.0);
        }

        @Test
        @DisplayName("ATR of a constant range equals that range")
        void constantRange() {
            double[] closes = new double[20];
            double[] highs = new double[20];
            double[] lows = new double[20];
            for (int i = 0; i < 20; i++) {
                closes[i] = 100;
                highs[i] = 101;
                lows[i] = 99;
            }
            double[] atr = Indicators.atr(highs, lows, closes, 14);

            assertThat(atr[13]).isNaN();
            assertThat(atr[14]).isCloseTo(2.0, within(1e-12));
            assertThat(Indicators.last(atr)).isCloseTo(2.0, within(1e-12));
        }
    }
}
