package dev.recipeflow.model;

import java.util.List;

/**
 * One {@code source -> step -> step -> ...;} statement.
 */
public record Rule(Input input, List<Action> actions) {

    public Rule {
        actions = List.copyOf(actions);
    }
}
