package com.swing.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A recommended option strategy with its concrete legs.
 *
 * <p>Each implementation is one template with its own fixed leg fields; the JSON
 * form of an implementation is exactly its legs, so {@link #name()} is not serialised.
 */
public interface OptionStrategy {

    @JsonIgnore
    StrategyName name();

    /** Weekly expiry label, e.g. "23 Oct '26". */
    String expiry();
}
