package dev.recipeflow.model;

import java.util.List;

/**
 * Where a rule's chain starts: either a list of ingredients or a join point fed by other rules.
 */
public sealed interface Input {

    /** A non-empty list of raw ingredients. */
    record Ingredients(List<IngredientRef> list) implements Input {
        public Ingredients {
            if (list.isEmpty()) {
                throw new IllegalArgumentException("ingredient input must not be empty");
            }
            list = List.copyOf(list);
        }
    }

    /** Continue a chain that previously fed into {@code point}. */
    record Join(Located point) implements Input {}
}
