package com.swing.strategy;

/**
 * The five option strategy templates, keyed by the label the dashboard shows.
 */
public enum StrategyName {

    BULL_CALL_SPREAD("Bull Call Spread"),
    ATM_CALL_BUY("ATM Call Buy"),
    BEAR_PUT_SPREAD("Bear Put Spread"),
    ATM_PUT_BUY("ATM Put Buy"),
    IRON_CONDOR("Iron Condor");

    private final String label;

    StrategyName(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
