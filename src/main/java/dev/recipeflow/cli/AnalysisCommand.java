package dev.recipeflow.cli;

import dev.recipeflow.RecipePipeline;
import dev.recipeflow.parser.RecipeSyntaxException;
import dev.recipeflow.render.DebugJson;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * Prints the analysis even when it has problems; they are part of the output.
 */
@Command(name = "debug-analysis", mixinStandardHelpOptions = true,
    description = "Print the analysis output as JSON")
class AnalysisCommand extends RecipeCommand {

    @Override
    protected String run(RecipePipeline pipeline, String source) throws RecipeSyntaxException, IOException {
        var analysis = pipeline.analyze(pipeline.parse(source));
        return DebugJson.pretty(new DebugJson(pipeline.store()).analysis(analysis)) + "\n";
    }
}
