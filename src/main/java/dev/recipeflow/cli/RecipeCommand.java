package dev.recipeflow.cli;

import dev.recipeflow.RecipePipeline;
import dev.recipeflow.engine.InvalidRecipeException;
import dev.recipeflow.parser.RecipeSyntaxException;
import dev.recipeflow.render.ProblemFormatter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shared input, output and error handling for the subcommands. Each
 * subcommand only turns a parsed recipe into text.
 */
abstract class RecipeCommand implements Callable<Integer> {

    private static final String STDIO = "-";

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Recipe source file (default: stdin)")
    private String input;

    @Parameters(index = "1", arity = "0..1", description = "Output file (default: stdout)")
    private String output;

    // applied by Main before picocli runs, while no logger exists yet
    @Option(names = "--verbose", description = "Log pipeline stages at debug level")
    boolean verbose;

    /**
     * Produce this command's output for the given source.
     */
    protected abstract String run(RecipePipeline pipeline, String source)
        throws RecipeSyntaxException, InvalidRecipeException, IOException;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        var pipeline = new RecipePipeline();
        try {
            String result = run(pipeline, readInput());
            writeOutput(result);
            return RecipeFlowCli.EXIT_OK;
        } catch (RecipeSyntaxException e) {
            err.println("Syntax error: " + e.getMessage());
            return RecipeFlowCli.EXIT_SYNTAX;
        } catch (InvalidRecipeException e) {
            err.println("Recipe has problems:");
            for (String message : new ProblemFormatter(pipeline.store()).describeAll(e.problems())) {
                err.println(" - " + message);
            }
            return RecipeFlowCli.EXIT_INVALID;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return RecipeFlowCli.EXIT_IO;
        } finally {
            err.flush();
        }
    }

    private String readInput() throws IOException {
        if (input == null || STDIO.equals(input)) {
            InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input));
    }

    private void writeOutput(String text) throws IOException {
        if (output == null || STDIO.equals(output)) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(text);
            out.flush();
            return;
        }
        Files.writeString(Path.of(output), text);
    }
}
