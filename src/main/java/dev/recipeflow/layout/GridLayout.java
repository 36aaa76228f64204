package dev.recipeflow.layout;

import dev.recipeflow.engine.BackwardTree;
import dev.recipeflow.model.Action;
import dev.recipeflow.model.Ingredient;
import dev.recipeflow.model.IngredientRef;
import dev.recipeflow.model.RecipeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lays a {@link BackwardTree} out as a grid of spanning cells.
 *
 * <p>Each ingredient starts a row and stretches right up to the first step
 * of its chain. A node's steps are drawn once, on the first row of its
 * subtree, spanning every row below it. The {@code <>} column closes the
 * first row and spans the whole grid.
 *
 * <pre>
 * | a | step1 | step3 | &lt;&gt; |
 * | b | step2 |       |    |
 * </pre>
 */
public final class GridLayout {

    private static final Logger log = LoggerFactory.getLogger(GridLayout.class);

    private final RecipeStore store;

    public GridLayout(RecipeStore store) {
        this.store = store;
    }

    /**
     * Produce the grid for {@code tree}. The tree is not modified, so laying
     * out the same tree twice gives equal grids. A tree with no paths gives
     * an empty grid.
     */
    public Grid layout(BackwardTree tree) {
        if (tree.isLeaf()) {
            return Grid.empty();
        }

        List<List<Cell>> rows = new ArrayList<>();
        // suffix cells of ancestors waiting for the next row, outermost first
        Deque<List<Cell>> pending = new ArrayDeque<>();
        Deque<Placement> stack = new ArrayDeque<>();
        stack.push(new Placement(tree, tree.maxDepth()));

        while (!stack.isEmpty()) {
            Placement placement = stack.pop();
            BackwardTree node = placement.node();
            int depth = placement.depth();

            boolean firstRow = true;
            for (IngredientRef ref : node.ingredients()) {
                var row = new ArrayList<Cell>();
                row.add(new Cell(1, depth - node.actions().size() + 1, ingredientContent(ref)));
                if (firstRow) {
                    if (node.isLeaf()) {
                        row.addAll(stepCells(node));
                    }
                    while (!pending.isEmpty()) {
                        row.addAll(pending.removeLast());
                    }
                    firstRow = false;
                }
                rows.add(row);
            }

            if (node.isLeaf()) {
                continue;
            }

            if (node == tree) {
                pending.addLast(List.of(new Cell(node.size(), 1, new CellContent.Sink())));
            } else if (!node.actions().isEmpty()) {
                pending.addLast(stepCells(node));
            }

            int childDepth = depth - node.actions().size();
            List<BackwardTree> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Placement(children.get(i), childDepth));
            }
        }

        var grid = new Grid(rows, tree.maxDepth() + 2);
        log.debug("Laid out grid: {} rows x {} columns", grid.rowCount(), grid.columns());
        return grid;
    }

    private List<Cell> stepCells(BackwardTree node) {
        var cells = new ArrayList<Cell>(node.actions().size());
        for (Action.Step step : node.actions()) {
            cells.add(new Cell(node.size(), 1, stepContent(step)));
        }
        return cells;
    }

    private CellContent.Step stepContent(Action.Step step) {
        var seasonings = new ArrayList<CellContent.Ingredient>(step.seasonings().size());
        for (IngredientRef ref : step.seasonings()) {
            seasonings.add(ingredientContent(ref));
        }
        return new CellContent.Step(store.text(step.name()), seasonings);
    }

    private CellContent.Ingredient ingredientContent(IngredientRef ref) {
        Ingredient ingredient = store.ingredient(ref);
        String amount = ingredient.hasAmount() ? store.text(ingredient.amount()) : null;
        return new CellContent.Ingredient(store.text(ingredient.name()), amount);
    }

    private record Placement(BackwardTree node, int depth) {}
}
