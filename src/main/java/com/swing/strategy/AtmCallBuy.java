package com.swing.strategy;

/**
 * Single long ATM call with an underlying target and stop-loss.
 */
public record AtmCallBuy(String buy, String expiry, String target, String stopLoss, String premium)
        implements OptionStrategy {

    @Override
    public StrategyName name() {
        return StrategyName.ATM_CALL_BUY;
    }
}
