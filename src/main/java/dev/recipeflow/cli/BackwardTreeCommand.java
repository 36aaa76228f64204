package dev.recipeflow.cli;

import dev.recipeflow.RecipePipeline;
import dev.recipeflow.engine.InvalidRecipeException;
import dev.recipeflow.parser.RecipeSyntaxException;
import dev.recipeflow.render.DebugJson;
import picocli.CommandLine.Command;

import java.io.IOException;

@Command(name = "debug-backward-tree", mixinStandardHelpOptions = true,
    description = "Print the generated backward tree as JSON")
class BackwardTreeCommand extends RecipeCommand {

    @Override
    protected String run(RecipePipeline pipeline, String source)
            throws RecipeSyntaxException, InvalidRecipeException, IOException {
        var tree = pipeline.tree(pipeline.parse(source));
        return DebugJson.pretty(new DebugJson(pipeline.store()).tree(tree)) + "\n";
    }
}
