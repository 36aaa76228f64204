package dev.recipeflow.model;

/**
 * An ingredient, optionally with an amount such as {@code [1 clove]}.
 */
public record Ingredient(
    Located amount, // nullable
    Located name
) {

    public boolean hasAmount() {
        return amount != null;
    }
}
