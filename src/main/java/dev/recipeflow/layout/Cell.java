package dev.recipeflow.layout;

/**
 * One cell of a layout grid. Spans are always at least 1.
 */
public record Cell(int rowSpan, int colSpan, CellContent content) {

    public Cell {
        if (rowSpan < 1 || colSpan < 1) {
            throw new IllegalArgumentException("Spans must be positive: rowSpan=%d, colSpan=%d"
                .formatted(rowSpan, colSpan));
        }
    }
}
