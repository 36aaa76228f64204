package dev.recipeflow.model;

import java.util.List;

/**
 * One element of a rule's action chain.
 */
public sealed interface Action {

    /** A processing step, with optional seasonings added at that step. */
    record Step(Located name, List<IngredientRef> seasonings) implements Action {
        public Step {
            seasonings = List.copyOf(seasonings);
        }
    }

    /** Merge the chain's output into a named join point. */
    record Join(Located point) implements Action {}

    /** Terminate the chain at the recipe's single sink, written {@code <>}. */
    record Done() implements Action {}
}
