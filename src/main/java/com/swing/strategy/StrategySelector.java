package com.swing.strategy;

import com.swing.model.Direction;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Picks one of the five option templates from a direction and confidence and fills
 * in its legs around the current price.
 *
 * <pre>
 * LONG    &gt; threshold  Bull Call Spread
 * LONG    &lt;= threshold ATM Call Buy
 * SHORT   &gt; threshold  Bear Put Spread
 * SHORT   &lt;= threshold ATM Put Buy
 * NEUTRAL any          Iron Condor
 * </pre>
 *
 * <p>All offsets are percentages of the underlying price so one configuration fits
 * every price level. Holds no mutable state.
 */
@Component
public class StrategySelector {

    private final int confidenceThreshold;
    private final double spreadOffsetPct;
    private final double condorShortPct;
    private final double condorWingPct;
    private final double targetPct;
    private final double stopLossPct;
    private final String currency;
    private final StrikeLadder ladder;

    public StrategySelector() {
        this(70, 3.0, 2.5, 4.0, 4.0, 1.5, "₹", StrikeLadder.DEFAULT_TIERS);
    }

    @Autowired
    public StrategySelector(
            @Value("${swing.strategy.confidence-threshold:70}") int confidenceThreshold,
            @Value("${swing.strategy.spread-offset-pct:3.0}") double spreadOffsetPct,
            @Value("${swing.strategy.condor-short-pct:2.5}") double condorShortPct,
            @Value("${swing.strategy.condor-wing-pct:4.0}") double condorWingPct,
            @Value("${swing.strategy.target-pct:4.0}") double targetPct,
            @Value("${swing.strategy.stop-loss-pct:1.5}") double stopLossPct,
            @Value("${swing.strategy.currency:₹}") String currency,
            @Value("${swing.strategy.strike-steps:5000:100,1000:50,500:20,0:10}") List<String> strikeSteps) {
        if (condorWingPct <= condorShortPct) {
            throw new IllegalArgumentException("Condor wings must sit further out than the short strikes");
        }
        this.confidenceThreshold = confidenceThreshold;
        this.spreadOffsetPct = spreadOffsetPct;
        this.condorShortPct = condorShortPct;
        this.condorWingPct = condorWingPct;
        this.targetPct = targetPct;
        this.stopLossPct = stopLossPct;
        this.currency = currency;
        this.ladder = StrikeLadder.parse(strikeSteps);
    }

    public OptionStrategy select(String symbol, Direction direction, int confidence,
                                 double price, double atr, LocalDate expiryDate) {
        String expiry = ExpiryCalendar.label(expiryDate);
        long atm = ladder.roundToStrike(price);
        boolean strong = confidence > confidenceThreshold;

        switch (direction) {
            case LONG:
                if (strong) {
                    return new BullCallSpread(
                            leg(symbol, atm, "CE"),
                            leg(symbol, ladder.roundToStrike(above(price, spreadOffsetPct)), "CE"),
                            expiry, money(atr * 3), money(atr * 1.5), money(atr * 1.2));
                }
                return new AtmCallBuy(leg(symbol, atm, "CE"), expiry,
                        level(above(price, targetPct)), level(below(price, stopLossPct)), money(atr * 0.8));
            case SHORT:
                if (strong) {
                    return new BearPutSpread(
                            leg(symbol, atm, "PE"),
                            leg(symbol, ladder.roundToStrike(below(price, spreadOffsetPct)), "PE"),
                            expiry, money(atr * 3), money(atr * 1.5), money(atr * 1.2));
                }
                return new AtmPutBuy(leg(symbol, atm, "PE"), expiry,
                        level(below(price, targetPct)), level(above(price, stopLossPct)), money(atr * 0.8));
            default:
                return new IronCondor(
                        leg(symbol, ladder.roundToStrike(above(price, condorShortPct)), "CE"),
                        leg(symbol, ladder.roundToStrike(above(price, condorWingPct)), "CE"),
                        leg(symbol, ladder.roundToStrike(below(price, condorShortPct)), "PE"),
                        leg(symbol, ladder.roundToStrike(below(price, condorWingPct)), "PE"),
                        expiry, money(atr * 0.6));
        }
    }

    public StrikeLadder getLadder() {
        return ladder;
    }

    private static double above(double price, double pct) {
        return price * (1 + pct / 100.0);
    }

    private static double below(double price, double pct) {
        return price * (1 - pct / 100.0);
    }

    private static String leg(String symbol, long strike, String type) {
        return symbol + " " + strike + " " + type;
    }

    private String money(double amount) {
        return currency + Math.round(amount);
    }

    private String level(double value) {
        return currency + String.format(Locale.ROOT, "%.2f", value);
    }
}
