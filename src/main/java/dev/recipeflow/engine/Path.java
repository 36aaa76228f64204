package dev.recipeflow.engine;

import dev.recipeflow.model.Action;
import dev.recipeflow.model.Input;

import java.util.List;

/**
 * One contiguous run of steps between two boundaries: a chain start or join
 * point at the front, a join point or the sink at the end.
 */
public record Path(Input start, List<Action.Step> actions) {

    public Path {
        actions = List.copyOf(actions);
    }
}
