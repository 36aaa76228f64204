package dev.recipeflow.render;

import dev.recipeflow.engine.Problem;
import dev.recipeflow.model.Action;
import dev.recipeflow.model.Input;
import dev.recipeflow.model.RecipeStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link Problem}s into messages a recipe author can act on.
 */
public final class ProblemFormatter {

    private final RecipeStore store;
    private final RecipePrinter printer;

    public ProblemFormatter(RecipeStore store) {
        this.store = store;
        this.printer = new RecipePrinter(store);
    }

    public List<String> describeAll(List<Problem> problems) {
        var messages = new ArrayList<String>(problems.size());
        for (Problem problem : problems) {
            messages.add(describe(problem));
        }
        return messages;
    }

    public String describe(Problem problem) {
        if (problem instanceof Problem.NoTerminal) {
            return "recipe has no '<>' step";
        } else if (problem instanceof Problem.DanglingChain dangling) {
            return describeDangling(dangling);
        } else if (problem instanceof Problem.Cycle cycle) {
            return "the join point '%s' is involved in a cycle".formatted(store.text(cycle.point()));
        } else if (problem instanceof Problem.UnresolvedJoin unresolved) {
            return "the join point '%s' is used but nothing ever leads into it"
                .formatted(store.text(unresolved.point()));
        }
        throw new IllegalArgumentException("Unknown problem: " + problem);
    }

    private String describeDangling(Problem.DanglingChain dangling) {
        var steps = new ArrayList<String>();
        for (Action.Step step : dangling.actions()) {
            steps.add(printer.step(step));
        }
        String chain = String.join(" -> ", steps);
        if (dangling.start() instanceof Input.Join join) {
            return "path starting at join point '%s' goes through '%s' but never reaches a join point or '<>'"
                .formatted(store.text(join.point()), chain);
        }
        return "path starting from ingredients '%s' goes through '%s' but never reaches a join point or '<>'"
            .formatted(printer.input(dangling.start()), chain);
    }
}
