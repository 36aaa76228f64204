package dev.recipeflow.layout;

import java.util.List;

/**
 * What a grid cell shows, with every symbol already resolved to text.
 */
public sealed interface CellContent {

    record Ingredient(String name, String amount) implements CellContent {
        public boolean hasAmount() {
            return amount != null;
        }
    }

    record Step(String name, List<Ingredient> seasonings) implements CellContent {
        public Step {
            seasonings = List.copyOf(seasonings);
        }
    }

    /** The recipe's terminal {@code <>}. */
    record Sink() implements CellContent {}
}
