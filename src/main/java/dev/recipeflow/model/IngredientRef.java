package dev.recipeflow.model;

/**
 * Index of an {@link Ingredient} in a {@link RecipeStore}.
 */
public record IngredientRef(int index) {}
