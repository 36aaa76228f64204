package dev.recipeflow;

import dev.recipeflow.cli.RecipeFlowCli;
import picocli.CommandLine;

import java.util.Arrays;

public class Main {

    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static void main(String[] args) {
        configureLogging(args);
        int exitCode = new CommandLine(new RecipeFlowCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * slf4j-simple reads its level once, when the first logger is created,
     * so {@code --verbose} has to be applied before any command runs.
     */
    static void configureLogging(String[] args) {
        if (Arrays.asList(args).contains("--verbose")) {
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }
    }
}
