package com.swing.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static, ordered list of tracked instruments plus the index reference symbol.
 */
public final class Universe {

    private final List<UniverseEntry> entries;
    private final Map<String, UniverseEntry> bySymbol;
    private final String indexSymbol;

    public Universe(List<UniverseEntry> entries, String indexSymbol) {
        if (entries == null || entries.isEmpty()) throw new IllegalArgumentException("Universe must not be empty");
        Map<String, UniverseEntry> map = new LinkedHashMap<>();
        for (UniverseEntry entry : entries) {
            if (map.putIfAbsent(entry.symbol(), entry) != null) {
                throw new IllegalArgumentException("Duplicate symbol in universe: " + entry.symbol());
            }
        }
        this.entries = List.copyOf(entries);
        this.bySymbol = map;
        this.indexSymbol = indexSymbol;
    }

    /**
     * Parse {@code SYMBOL:Sector} tokens, e.g. {@code ["RELIANCE:Energy", "TCS:IT"]}.
     * A token without a sector gets "Misc".
     */
    public static Universe parse(List<String> tokens, String indexSymbol) {
        List<UniverseEntry> entries = new ArrayList<>();
        for (String token : tokens) {
            if (token == null || token.isBlank()) continue;
            String trimmed = token.trim();
            int sep = trimmed.indexOf(':');
            String symbol = (sep < 0 ? trimmed : trimmed.substring(0, sep)).trim().toUpperCase(Locale.ROOT);
            String sector = sep < 0 ? null : trimmed.substring(sep + 1);
            entries.add(new UniverseEntry(symbol, sector));
        }
        return new Universe(entries, indexSymbol);
    }

    public List<UniverseEntry> getEntries() {
        return entries;
    }

    public Optional<UniverseEntry> find(String symbol) {
        if (symbol == null) return Optional.empty();
        return Optional.ofNullable(bySymbol.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    public String getIndexSymbol() {
        return indexSymbol;
    }

    public int size() {
        return entries.size();
    }
}
