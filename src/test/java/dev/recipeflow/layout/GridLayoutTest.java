package dev.recipeflow.layout;

import dev.recipeflow.engine.BackwardTree;
import dev.recipeflow.engine.FlowAnalyzer;
import dev.recipeflow.engine.TreeMaterializer;
import dev.recipeflow.model.RecipeStore;
import dev.recipeflow.parser.RecipeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GridLayoutTest {

    private final RecipeStore store = new RecipeStore();
    private final GridLayout layout = new GridLayout(store);

    private BackwardTree tree(String source) throws Exception {
        var recipe = new RecipeParser(store).parse(source);
        return TreeMaterializer.intoTree(FlowAnalyzer.analyze(store, recipe));
    }

    private static Cell ingredient(String name, int colSpan) {
        return new Cell(1, colSpan, new CellContent.Ingredient(name, null));
    }

    private static Cell step(String name, int rowSpan) {
        return new Cell(rowSpan, 1, new CellContent.Step(name, List.of()));
    }

    private static Cell sink(int rowSpan) {
        return new Cell(rowSpan, 1, new CellContent.Sink());
    }

    private static void assertRectangular(Grid grid, BackwardTree tree) {
        assertThat(grid.columns()).isEqualTo(tree.maxDepth() + 2);
        assertThat(grid.rowWidths()).containsOnly(grid.columns());
    }

    @Test
    void sharedStepSpansBothRows() throws Exception {
        BackwardTree tree = tree("r { a -> step1 -> $j; b -> step2 -> $j; $j -> step3 -> <>; }");

        Grid grid = layout.layout(tree);

        assertThat(grid.rows()).containsExactly(
            List.of(ingredient("a", 1), step("step1", 1), step("step3", 2), sink(2)),
            List.of(ingredient("b", 1), step("step2", 1)));
        // three ingredient and step columns plus the <> column
        assertRectangular(grid, tree);
    }

    @Test
    void shortBranchIngredientStretchesToFillColumns() throws Exception {
        BackwardTree tree = tree("""
            sample {
              one -> foo -> $a;
              two -> bar -> $a;
              $a -> baz -> <>;
              three -> quux -> <>;
            }
            """);

        Grid grid = layout.layout(tree);

        assertThat(grid.rows()).containsExactly(
            List.of(ingredient("one", 1), step("foo", 1), step("baz", 2), sink(3)),
            List.of(ingredient("two", 1), step("bar", 1)),
            List.of(ingredient("three", 2), step("quux", 1)));
        assertRectangular(grid, tree);
    }

    @Test
    void stepsOfMultiIngredientLeafSpanAllItsRows() throws Exception {
        BackwardTree tree = tree("r { a + b -> mix -> <>; }");

        Grid grid = layout.layout(tree);

        assertThat(grid.rows()).containsExactly(
            List.of(ingredient("a", 1), step("mix", 2), sink(2)),
            List.of(ingredient("b", 1)));
        assertRectangular(grid, tree);
    }

    @Test
    void ingredientStraightIntoDone() throws Exception {
        BackwardTree tree = tree("r { salt -> <>; }");

        Grid grid = layout.layout(tree);

        assertThat(grid.rows()).containsExactly(List.of(ingredient("salt", 1), sink(1)));
        assertRectangular(grid, tree);
    }

    @Test
    void joinWithoutStepsAddsNoCells() throws Exception {
        BackwardTree tree = tree("r { a -> x -> $j; $j -> <>; }");

        Grid grid = layout.layout(tree);

        assertThat(grid.rows()).containsExactly(List.of(ingredient("a", 1), step("x", 1), sink(1)));
        assertRectangular(grid, tree);
    }

    @Test
    void resolvesAmountsAndSeasonings() throws Exception {
        BackwardTree tree = tree("""
            nicer scrambled eggs {
              [1/2] onion + [1 clove] garlic
                -> chop coarsely -> sautee & butter -> $mix;
              [2] eggs -> whisk -> $mix;
              $mix -> stir & salt -> <>;
            }
            """);

        Grid grid = layout.layout(tree);

        assertThat(grid.rowCount()).isEqualTo(3);
        List<Cell> first = grid.rows().get(0);
        assertThat(first).hasSize(5);
        assertThat(first.get(0).content()).isEqualTo(new CellContent.Ingredient("onion", "1/2"));
        assertThat(first.get(2)).isEqualTo(new Cell(2, 1, new CellContent.Step("sautee",
            List.of(new CellContent.Ingredient("butter", null)))));
        assertThat(first.get(3).rowSpan()).isEqualTo(3);
        assertThat(grid.rows().get(1)).containsExactly(new Cell(1, 1, new CellContent.Ingredient("garlic", "1 clove")));
        assertThat(grid.rows().get(2).get(0)).isEqualTo(new Cell(1, 2, new CellContent.Ingredient("eggs", "2")));
        assertRectangular(grid, tree);
    }

    @Test
    void layingOutTwiceGivesEqualGrids() throws Exception {
        BackwardTree tree = tree("""
            r {
              a -> x -> $p;
              b + c -> y -> z -> $p;
              $p -> w -> $q;
              d -> v -> $q;
              $q -> u -> <>;
            }
            """);

        Grid first = layout.layout(tree);
        Grid second = layout.layout(tree);

        assertThat(second).isEqualTo(first);
        assertRectangular(first, tree);
    }

    @Test
    void treeWithoutPathsGivesEmptyGrid() {
        var empty = new BackwardTree(List.of(), List.of(), List.of(), 0, 0);

        Grid grid = layout.layout(empty);

        assertThat(grid.isEmpty()).isTrue();
        assertThat(grid.rowCount()).isZero();
    }

    @Test
    void longChainsDoNotOverflowTheStack() throws Exception {
        int links = 5_000;
        var source = new StringBuilder("deep {\n  a -> s -> $j0;\n");
        for (int i = 1; i < links; i++) {
            source.append("  $j").append(i - 1).append(" -> s -> $j").append(i).append(";\n");
        }
        source.append("  $j").append(links - 1).append(" -> s -> <>;\n}\n");
        BackwardTree tree = tree(source.toString());

        Grid grid = layout.layout(tree);

        assertThat(grid.rowCount()).isEqualTo(1);
        assertThat(grid.rows().get(0)).hasSize(links + 3);
        assertRectangular(grid, tree);
    }
}
