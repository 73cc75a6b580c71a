package com.swing.indicator;

import com.swing.model.BollingerBands;

import java.util.Arrays;

/**
 * Pure technical indicator functions over oldest-first price arrays.
 *
 * <p>Series functions return an array aligned with the input; positions before the
 * first defined value hold {@link Double#NaN}. Every function throws
 * {@link InsufficientHistoryException} when the input is shorter than its window.
 * Nothing here keeps state, so identical input always yields identical output.
 */
public final class Indicators {

    public static final int RSI_PERIOD = 14;
    public static final int ATR_PERIOD = 14;
    public static final int SMA_PERIOD = 20;
    public static final int EMA_FAST = 9;
    public static final int EMA_SLOW = 21;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_K = 2.0;

    private Indicators() {
    }

    /**
     * Trailing arithmetic mean; defined from index {@code period - 1}.
     */
    public static double[] sma(double[] values, int period) {
        require("SMA" + period, period, values.length);
        double[] out = nanArray(values.length);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) sum -= values[i - period];
            if (i >= period - 1) out[i] = sum / period;
        }
        return out;
    }

    /**
     * Exponential moving average with alpha = 2 / (period + 1), seeded with the simple
     * mean of the first {@code period} defined values. Leading NaNs are skipped, which
     * lets the MACD signal line run over a MACD line that starts late.
     */
    public static double[] ema(double[] values, int period) {
        int start = firstDefined(values);
        int definedCount = start < 0 ? 0 : values.length - start;
        require("EMA" + period, period, definedCount);

        double[] out = nanArray(values.length);
        int seedIndex = start + period - 1;
        double seed = 0.0;
        for (int i = start; i <= seedIndex; i++) seed += values[i];
        double prev = seed / period;
        out[seedIndex] = prev;

        double alpha = 2.0 / (period + 1.0);
        for (int i = seedIndex + 1; i < values.length; i++) {
            prev = values[i] * alpha + prev * (1 - alpha);
            out[i] = prev;
        }
        return out;
    }

    /**
     * Wilder RSI. The first average gain/loss is the simple mean of the first
     * {@code period} deltas; later values use {@code avg = (avg * (n - 1) + current) / n}.
     */
    public static double[] rsi(double[] closes, int period) {
        require("RSI" + period, period + 1, closes.length);
        double[] out = nanArray(closes.length);

        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) gain += diff;
            else loss -= diff;
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        out[period] = rsiFromAverages(avgGain, avgLoss);

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(diff, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-diff, 0)) / period;
            out[i] = rsiFromAverages(avgGain, avgLoss);
        }
        return out;
    }

    /**
     * MACD line, signal line and histogram. The line needs {@code slow} points and the
     * signal {@code slow + signal - 1}; with fewer the signal and histogram stay all NaN.
     * Histogram is exactly line minus signal.
     */
    public static MacdSeries macd(double[] closes, int fast, int slow, int signal) {
        require("MACD", slow, closes.length);
        double[] emaFast = ema(closes, fast);
        double[] emaSlow = ema(closes, slow);

        double[] line = nanArray(closes.length);
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isNaN(emaFast[i]) && !Double.isNaN(emaSlow[i])) {
                line[i] = emaFast[i] - emaSlow[i];
            }
        }

        double[] signalLine = closes.length >= slow + signal - 1 ? ema(line, signal) : nanArray(closes.length);
        double[] histogram = nanArray(closes.length);
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isNaN(line[i]) && !Double.isNaN(signalLine[i])) {
                histogram[i] = line[i] - signalLine[i];
            }
        }
        return new MacdSeries(line, signalLine, histogram);
    }

    /**
     * Bollinger bands over the trailing {@code period} closes using the sample
     * standard deviation of that same window.
     */
    public static BollingerBands bollinger(double[] closes, int period, double k) {
        require("Bollinger" + period, period, closes.length);
        int from = closes.length - period;
        double mean = 0.0;
        for (int i = from; i < closes.length; i++) mean += closes[i];
        mean /= period;

        double var = 0.0;
        for (int i = from; i < closes.length; i++) {
            double d = closes[i] - mean;
            var += d * d;
        }
        double std = period > 1 ? Math.sqrt(var / (period - 1)) : 0.0;
        return new BollingerBands(mean + k * std, mean, mean - k * std);
    }

    /**
     * Average true range with Wilder smoothing, seeded like {@link #rsi(double[], int)}.
     */
    public static double[] atr(double[] highs, double[] lows, double[] closes, int period) {
        if (highs.length != closes.length || lows.length != closes.length) {
            throw new IllegalArgumentException("High, low and close series must have equal length");
        }
        require("ATR" + period, period + 1, closes.length);
        double[] out = nanArray(closes.length);

        double sum = 0.0;
        for (int i = 1; i <= period; i++) sum += trueRange(highs[i], lows[i], closes[i - 1]);
        double avg = sum / period;
        out[period] = avg;

        for (int i = period + 1; i < closes.length; i++) {
            avg = (avg * (period - 1) + trueRange(highs[i], lows[i], closes[i - 1])) / period;
            out[i] = avg;
        }
        return out;
    }

    public static double trueRange(double high, double low, double prevClose) {
        return Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
    }

    public static double last(double[] series) {
        return series[series.length - 1];
    }

    private static double rsiFromAverages(double avgGain, double avgLoss) {
        if (avgLoss == 0) return 100.0;
        double rsi = 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
        return Math.max(0.0, Math.min(100.0, rsi));
    }

    private static void require(String indicator, int required, int available) {
        if (available < required) throw new InsufficientHistoryException(indicator, required, available);
    }

    private static int firstDefined(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) return i;
        }
        return -1;
    }

    private static double[] nanArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    /**
     * Aligned MACD arrays.
     */
    public record MacdSeries(double[] line, double[] signal, double[] histogram) {

        public boolean hasSignal() {
            return !Double.isNaN(last(signal));
        }
    }
}
