package dev.recipeflow.engine;

import java.util.List;

/**
 * Thrown when a recipe with graph problems is asked to become a tree.
 * Carries every problem found, in the order the analyzer recorded them.
 */
public class InvalidRecipeException extends Exception {

    private final List<Problem> problems;

    public InvalidRecipeException(List<Problem> problems) {
        super("Recipe has %d problem(s)".formatted(problems.size()));
        this.problems = List.copyOf(problems);
    }

    public List<Problem> problems() {
        return problems;
    }
}
