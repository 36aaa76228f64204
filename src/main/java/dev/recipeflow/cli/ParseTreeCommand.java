package dev.recipeflow.cli;

import dev.recipeflow.RecipePipeline;
import dev.recipeflow.parser.RecipeSyntaxException;
import dev.recipeflow.render.RecipePrinter;
import picocli.CommandLine.Command;

@Command(name = "debug-parse-tree", mixinStandardHelpOptions = true,
    description = "Print the parsed recipe in canonical form")
class ParseTreeCommand extends RecipeCommand {

    @Override
    protected String run(RecipePipeline pipeline, String source) throws RecipeSyntaxException {
        return new RecipePrinter(pipeline.store()).print(pipeline.parse(source));
    }
}
