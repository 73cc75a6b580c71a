package com.swing.model;

/**
 * One tracked instrument.
 *
 * @param symbol Exchange symbol, upper case
 * @param sector Sector label
 */
public record UniverseEntry(String symbol, String sector) {

    public UniverseEntry {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("Symbol must not be blank");
        sector = sector == null || sector.isBlank() ? "Misc" : sector.trim();
    }
}
