package dev.recipeflow.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only string interner. Symbols are never removed, so a handle stays
 * valid for the lifetime of the table.
 */
public final class SymbolTable {

    private final Map<String, Symbol> index = new HashMap<>();
    private final List<String> strings = new ArrayList<>();

    public Symbol intern(String text) {
        var existing = index.get(text);
        if (existing != null) {
            return existing;
        }
        var symbol = new Symbol(strings.size());
        strings.add(text);
        index.put(text, symbol);
        return symbol;
    }

    public String resolve(Symbol symbol) {
        if (symbol.id() < 0 || symbol.id() >= strings.size()) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol.id());
        }
        return strings.get(symbol.id());
    }

    public int size() {
        return strings.size();
    }
}
