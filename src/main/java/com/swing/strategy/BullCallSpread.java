package com.swing.strategy;

/**
 * Buy the ATM call, sell an OTM call above it.
 */
public record BullCallSpread(String buy, String sell, String expiry,
                             String maxProfit, String maxLoss, String premium) implements OptionStrategy {

    @Override
    public StrategyName name() {
        return StrategyName.BULL_CALL_SPREAD;
    }
}
