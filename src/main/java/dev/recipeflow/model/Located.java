package dev.recipeflow.model;

/**
 * A symbol together with the half-open source span {@code [start, end)} it was read from.
 * The span is only used for diagnostics.
 */
public record Located(Symbol symbol, int start, int end) {

    public static Located synthetic(Symbol symbol) {
        return new Located(symbol, 0, 0);
    }
}
