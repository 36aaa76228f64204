package dev.recipeflow.engine;

import dev.recipeflow.model.Action;
import dev.recipeflow.model.Input;
import dev.recipeflow.model.Symbol;

import java.util.List;

/**
 * An invariant violation that prevents a recipe from being turned into a
 * {@link BackwardTree}.
 */
public sealed interface Problem {

    /** No chain ever reaches {@code <>}, so there is nothing to work backwards from. */
    record NoTerminal() implements Problem {}

    /**
     * A chain ends after some steps without reaching a join point or {@code <>};
     * those steps lead nowhere.
     */
    record DanglingChain(List<Action.Step> actions, Input start) implements Problem {
        public DanglingChain {
            actions = List.copyOf(actions);
        }
    }

    /** The join point can reach itself through join-point references. */
    record Cycle(Symbol point) implements Problem {}

    /** A chain starts from a join point that no other chain feeds into. */
    record UnresolvedJoin(Symbol point) implements Problem {}
}
