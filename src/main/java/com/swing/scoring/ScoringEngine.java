package com.swing.scoring;

import com.swing.model.Direction;
import com.swing.model.IndicatorSet;
import com.swing.model.Signal;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns an {@link IndicatorSet} into a signed score, a direction and a confidence.
 *
 * <p>Rules are evaluated independently and in a fixed order; every rule that fires
 * adds its weight and one reason line. Indicators that are unavailable never fire.
 */
@Component
public class ScoringEngine {

    public static final double RSI_OVERSOLD = 35.0;
    public static final double RSI_OVERBOUGHT = 65.0;
    public static final double BB_LOWER_ZONE = 0.25;
    public static final double BB_UPPER_ZONE = 0.75;
    public static final double SMA_BAND = 0.02;

    public static final double W_RSI = 2.0;
    public static final double W_MACD = 1.5;
    public static final double W_EMA = 1.0;
    public static final double W_BOLLINGER = 1.5;
    public static final double W_SMA = 0.5;

    /** Largest |score| the rule table can produce (6.5). */
    public static final double MAX_SCORE = W_RSI + W_MACD + W_EMA + W_BOLLINGER + W_SMA;

    /** Confidence reaches 100 only above this |score|, so the default tops out at 93. */
    public static final double DEFAULT_CONFIDENCE_DIVISOR = 7.0;

    private final double confidenceDivisor;

    public ScoringEngine() {
        this(DEFAULT_CONFIDENCE_DIVISOR);
    }

    @Autowired
    public ScoringEngine(@Value("${swing.scoring.confidence-divisor:7.0}") double confidenceDivisor) {
        if (confidenceDivisor <= 0) throw new IllegalArgumentException("Confidence divisor must be positive");
        this.confidenceDivisor = confidenceDivisor;
    }

    public Signal score(IndicatorSet indicators, double price) {
        double score = 0.0;
        List<String> reasons = new ArrayList<>();

        Double rsi = indicators.rsi();
        if (rsi != null && rsi < RSI_OVERSOLD) {
            score += W_RSI;
            reasons.add("RSI oversold (" + fmt(rsi, 1) + ")");
        }
        if (rsi != null && rsi > RSI_OVERBOUGHT) {
            score -= W_RSI;
            reasons.add("RSI overbought (" + fmt(rsi, 1) + ")");
        }

        if (indicators.macd() != null && indicators.macd().hasSignal()) {
            double hist = indicators.macd().histogram();
            if (hist > 0) {
                score += W_MACD;
                reasons.add("MACD histogram positive (" + fmt(hist, 2) + ")");
            }
            if (hist < 0) {
                score -= W_MACD;
                reasons.add("MACD histogram negative (" + fmt(hist, 2) + ")");
            }
        }

        Double ema9 = indicators.ema9();
        Double ema21 = indicators.ema21();
        if (ema9 != null && ema21 != null) {
            if (ema9 > ema21) {
                score += W_EMA;
                reasons.add("9 EMA above 21 EMA");
            }
            if (ema9 < ema21) {
                score -= W_EMA;
                reasons.add("9 EMA below 21 EMA");
            }
        }

        Double bbPos = indicators.bbPosition();
        if (bbPos != null && bbPos < BB_LOWER_ZONE) {
            score += W_BOLLINGER;
            reasons.add("Price near lower Bollinger band (" + fmt(bbPos, 2) + ")");
        }
        if (bbPos != null && bbPos > BB_UPPER_ZONE) {
            score -= W_BOLLINGER;
            reasons.add("Price near upper Bollinger band (" + fmt(bbPos, 2) + ")");
        }

        Double sma20 = indicators.sma20();
        if (sma20 != null && price > sma20 * (1 + SMA_BAND)) {
            score += W_SMA;
            reasons.add("Price more than 2% above 20 SMA");
        }
        if (sma20 != null && price < sma20 * (1 - SMA_BAND)) {
            score -= W_SMA;
            reasons.add("Price more than 2% below 20 SMA");
        }

        return new Signal(score, directionOf(score), confidenceOf(score), reasons);
    }

    /**
     * LONG at score >= 1, SHORT at score <= -1, NEUTRAL strictly between.
     */
    public static Direction directionOf(double score) {
        if (score >= 1.0) return Direction.LONG;
        if (score <= -1.0) return Direction.SHORT;
        return Direction.NEUTRAL;
    }

    public int confidenceOf(double score) {
        long pct = Math.round(Math.abs(score) / confidenceDivisor * 100.0);
        return (int) Math.min(100L, pct);
    }

    private static String fmt(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
