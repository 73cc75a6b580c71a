package com.swing.strategy;

/**
 * Short OTM call and put with further-OTM wings bought on both sides.
 */
public record IronCondor(String sellCall, String buyCall, String sellPut, String buyPut,
                         String expiry, String premium) implements OptionStrategy {

    @Override
    public StrategyName name() {
        return StrategyName.IRON_CONDOR;
    }
}
