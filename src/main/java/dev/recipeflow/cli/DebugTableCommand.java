package dev.recipeflow.cli;

import dev.recipeflow.RecipePipeline;
import dev.recipeflow.engine.InvalidRecipeException;
import dev.recipeflow.parser.RecipeSyntaxException;
import dev.recipeflow.render.DebugTableRenderer;
import picocli.CommandLine.Command;

@Command(name = "debug-table", mixinStandardHelpOptions = true,
    description = "Print the raw table layout")
class DebugTableCommand extends RecipeCommand {

    @Override
    protected String run(RecipePipeline pipeline, String source)
            throws RecipeSyntaxException, InvalidRecipeException {
        return DebugTableRenderer.render(pipeline.layout(pipeline.parse(source)));
    }
}
