package dev.recipeflow.render;

import dev.recipeflow.model.RecipeStore;
import dev.recipeflow.parser.RecipeParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecipePrinterTest {

    @Test
    void printsCanonicalSource() throws Exception {
        var store = new RecipeStore();
        var recipe = new RecipeParser(store).parse("""
            nicer scrambled eggs {
              [1/2] onion + [1 clove] garlic
                -> chop coarsely -> sautee & butter -> $mix;
              [2] eggs -> whisk -> $mix;
              $mix -> stir & salt -> <>;
            }
            """);

        assertThat(new RecipePrinter(store).print(recipe)).isEqualTo("""
            nicer scrambled eggs {
              [1/2] onion + [1 clove] garlic -> chop coarsely -> sautee & butter -> $mix;
              [2] eggs -> whisk -> $mix;
              $mix -> stir & salt -> <>;
            }
            """);
    }

    @Test
    void printedSourceParsesToTheSameText() throws Exception {
        var store = new RecipeStore();
        String printed = new RecipePrinter(store).print(
            new RecipeParser(store).parse("r{a+b->x&[1]c->$j;$j->y-><>;}"));

        var reparsedStore = new RecipeStore();
        String reprinted = new RecipePrinter(reparsedStore).print(new RecipeParser(reparsedStore).parse(printed));

        assertThat(reprinted).isEqualTo(printed);
        assertThat(printed).isEqualTo("r {\n  a + b -> x & [1] c -> $j;\n  $j -> y -> <>;\n}\n");
    }
}
