package com.swing.strategy;

/**
 * Buy the ATM put, sell an OTM put below it.
 */
public record BearPutSpread(String buy, String sell, String expiry,
                            String maxProfit, String maxLoss, String premium) implements OptionStrategy {

    @Override
    public StrategyName name() {
        return StrategyName.BEAR_PUT_SPREAD;
    }
}
