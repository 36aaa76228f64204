package dev.recipeflow.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for recipe-flow.
 */
@Command(
    name = "recipe-flow",
    mixinStandardHelpOptions = true,
    version = "recipe-flow 0.1.0",
    description = "Compile recipe flow notation into table layouts.",
    subcommands = {
        ParseTreeCommand.class,
        AnalysisCommand.class,
        BackwardTreeCommand.class,
        DebugTableCommand.class,
        HtmlTableCommand.class
    }
)
public class RecipeFlowCli implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_SYNTAX = 3;
    public static final int EXIT_IO = 4;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Error: a subcommand is required.");
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE;
    }
}
