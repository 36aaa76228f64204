package dev.recipeflow.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Rows of spanning cells. A cell with {@code rowSpan > 1} also covers its
 * columns in the rows below it, which then omit those cells.
 *
 * <p>Every row covers {@code columns()} columns: the ingredient and step
 * columns ({@code maxDepth + 1} of them) plus the final {@code <>} column.
 */
public record Grid(List<List<Cell>> rows, int columns) {

    public Grid {
        var copy = new ArrayList<List<Cell>>(rows.size());
        for (List<Cell> row : rows) {
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    public static Grid empty() {
        return new Grid(List.of(), 0);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Columns covered by each row, counting cells that reach down from the rows above.
     */
    public int[] rowWidths() {
        int[] widths = new int[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            for (Cell cell : rows.get(r)) {
                int last = Math.min(rows.size(), r + cell.rowSpan());
                for (int covered = r; covered < last; covered++) {
                    widths[covered] += cell.colSpan();
                }
            }
        }
        return widths;
    }
}
