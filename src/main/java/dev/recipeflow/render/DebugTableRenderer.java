package dev.recipeflow.render;

import dev.recipeflow.layout.Cell;
import dev.recipeflow.layout.CellContent;
import dev.recipeflow.layout.Grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text dump of a grid: one line per row, each cell as {@code (colspan, rowspan, content)}.
 */
public final class DebugTableRenderer {

    private DebugTableRenderer() {}

    public static String render(Grid grid) {
        var sb = new StringBuilder();
        for (List<Cell> row : grid.rows()) {
            for (Cell cell : row) {
                sb.append(" (").append(cell.colSpan())
                  .append(", ").append(cell.rowSpan())
                  .append(", ").append(describe(cell.content()))
                  .append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String describe(CellContent content) {
        if (content instanceof CellContent.Ingredient ingredient) {
            return ingredient(ingredient);
        } else if (content instanceof CellContent.Step step) {
            if (step.seasonings().isEmpty()) {
                return step.name();
            }
            var seasonings = new ArrayList<String>();
            for (CellContent.Ingredient seasoning : step.seasonings()) {
                seasonings.add(ingredient(seasoning));
            }
            return step.name() + " & " + String.join(",", seasonings);
        }
        return "<>";
    }

    private static String ingredient(CellContent.Ingredient ingredient) {
        return ingredient.hasAmount()
            ? "[" + ingredient.amount() + "] " + ingredient.name()
            : ingredient.name();
    }
}
