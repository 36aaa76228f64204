package dev.recipeflow.model;

/**
 * Index of a {@link Rule} in a {@link RecipeStore}.
 */
public record RuleRef(int index) {}
