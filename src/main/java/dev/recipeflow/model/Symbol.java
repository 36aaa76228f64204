package dev.recipeflow.model;

/**
 * Handle for a string interned in a {@link SymbolTable}. Two symbols from the
 * same table are equal iff their strings are equal.
 */
public record Symbol(int id) {}
