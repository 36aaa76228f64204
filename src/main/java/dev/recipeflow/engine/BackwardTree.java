package dev.recipeflow.engine;

import dev.recipeflow.model.Action;
import dev.recipeflow.model.IngredientRef;

import java.util.List;

/**
 * A recipe read backwards from {@code <>}: join points are gone and every
 * node owns its children outright.
 *
 * <p>The root has no actions and no ingredients. Only leaves carry
 * ingredients. {@code size} is the number of ingredient rows under a node and
 * {@code maxDepth} is the node's own action count plus the deepest child's
 * {@code maxDepth}.
 */
public record BackwardTree(
    List<Action.Step> actions,
    List<BackwardTree> children,
    List<IngredientRef> ingredients,
    int size,
    int maxDepth
) {

    public BackwardTree {
        actions = List.copyOf(actions);
        children = List.copyOf(children);
        ingredients = List.copyOf(ingredients);
    }

    static BackwardTree leaf(List<Action.Step> actions, List<IngredientRef> ingredients) {
        return new BackwardTree(actions, List.of(), ingredients, ingredients.size(), actions.size());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * True for the sink node: no actions and no ingredients of its own.
     */
    public boolean isSink() {
        return actions.isEmpty() && ingredients.isEmpty();
    }
}
