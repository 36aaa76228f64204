package dev.recipeflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.recipeflow.RecipePipeline;
import dev.recipeflow.config.TableOptions;
import dev.recipeflow.config.TableOptionsLoader;
import dev.recipeflow.engine.InvalidRecipeException;
import dev.recipeflow.parser.RecipeSyntaxException;
import dev.recipeflow.render.HtmlTableRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

import java.io.IOException;
import java.nio.file.Path;

@Command(name = "html-table", mixinStandardHelpOptions = true,
    description = "Convert the recipe to an HTML table")
class HtmlTableCommand extends RecipeCommand {

    @Option(names = "--config", description = "JSON file with table options; flags below override it")
    private Path config;

    @Option(names = "--standalone", description = "Wrap the table in a full HTML document")
    private boolean standalone;

    @Option(names = "--html-header", description = "HTML written before the table in standalone mode")
    private String htmlHeader;

    @Option(names = "--html-footer", description = "HTML written after the table in standalone mode")
    private String htmlFooter;

    @Option(names = "--amount-class", description = "CSS class for ingredient amounts")
    private String amountClass;

    @Option(names = "--seasonings-class", description = "CSS class for step seasonings")
    private String seasoningsClass;

    @Option(names = "--ingredient-class", description = "CSS class for ingredient cells")
    private String ingredientClass;

    @Option(names = "--action-class", description = "CSS class for step cells")
    private String actionClass;

    @Option(names = "--done-class", description = "CSS class for the final cell")
    private String doneClass;

    @Override
    protected String run(RecipePipeline pipeline, String source)
            throws RecipeSyntaxException, InvalidRecipeException, IOException {
        var grid = pipeline.layout(pipeline.parse(source));
        return new HtmlTableRenderer(options()).render(grid);
    }

    TableOptions options() throws IOException {
        TableOptions options = TableOptions.defaults();
        if (config != null) {
            try {
                options = TableOptionsLoader.loadFromFile(config);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(),
                    "Invalid table options in " + config + ": " + e.getMessage());
            }
        }

        if (standalone) {
            options = options.withStandalone(true);
        }
        if (htmlHeader != null) {
            options = options.withHtmlHeader(htmlHeader);
        }
        if (htmlFooter != null) {
            options = options.withHtmlFooter(htmlFooter);
        }
        if (amountClass != null) {
            options = options.withAmountClass(amountClass);
        }
        if (seasoningsClass != null) {
            options = options.withSeasoningsClass(seasoningsClass);
        }
        if (ingredientClass != null) {
            options = options.withIngredientClass(ingredientClass);
        }
        if (actionClass != null) {
            options = options.withActionClass(actionClass);
        }
        if (doneClass != null) {
            options = options.withDoneClass(doneClass);
        }
        return options;
    }
}
