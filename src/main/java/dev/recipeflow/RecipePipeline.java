package dev.recipeflow;

import dev.recipeflow.engine.Analysis;
import dev.recipeflow.engine.BackwardTree;
import dev.recipeflow.engine.FlowAnalyzer;
import dev.recipeflow.engine.InvalidRecipeException;
import dev.recipeflow.engine.TreeMaterializer;
import dev.recipeflow.layout.Grid;
import dev.recipeflow.layout.GridLayout;
import dev.recipeflow.model.Recipe;
import dev.recipeflow.model.RecipeStore;
import dev.recipeflow.parser.RecipeParser;
import dev.recipeflow.parser.RecipeSyntaxException;

/**
 * Runs the stages of one compilation against a shared {@link RecipeStore}:
 * source text to recipe, recipe to analysis, analysis to tree, tree to grid.
 */
public final class RecipePipeline {

    private final RecipeStore store = new RecipeStore();

    public RecipeStore store() {
        return store;
    }

    public Recipe parse(String source) throws RecipeSyntaxException {
        return new RecipeParser(store).parse(source);
    }

    public Analysis analyze(Recipe recipe) {
        return FlowAnalyzer.analyze(store, recipe);
    }

    public BackwardTree tree(Recipe recipe) throws InvalidRecipeException {
        return TreeMaterializer.intoTree(analyze(recipe));
    }

    public Grid layout(BackwardTree tree) {
        return new GridLayout(store).layout(tree);
    }

    public Grid layout(Recipe recipe) throws InvalidRecipeException {
        return layout(tree(recipe));
    }
}
