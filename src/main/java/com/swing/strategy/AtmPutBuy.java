package com.swing.strategy;

/**
 * Single long ATM put with an underlying target and stop-loss.
 */
public record AtmPutBuy(String buy, String expiry, String target, String stopLoss, String premium)
        implements OptionStrategy {

    @Override
    public StrategyName name() {
        return StrategyName.ATM_PUT_BUY;
    }
}
