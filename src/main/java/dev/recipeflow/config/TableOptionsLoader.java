package dev.recipeflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads {@link TableOptions} from JSON. Keys that are absent keep their defaults.
 *
 * <pre>
 * { "standalone": true, "ingredientClass": "ing", "doneClass": "fin" }
 * </pre>
 */
public final class TableOptionsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TableOptionsLoader() {}

    public static TableOptions loadFromFile(Path path) throws IOException {
        return parseOptions(MAPPER.readTree(path.toFile()), TableOptions.defaults());
    }

    public static TableOptions loadFromString(String json) throws IOException {
        return parseOptions(MAPPER.readTree(json), TableOptions.defaults());
    }

    /**
     * Apply the keys present in {@code node} on top of {@code base}.
     */
    static TableOptions parseOptions(JsonNode node, TableOptions base) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Table options must be a JSON object");
        }
        TableOptions options = base;
        if (node.has("standalone")) {
            options = options.withStandalone(node.get("standalone").asBoolean());
        }
        if (node.has("htmlHeader")) {
            options = options.withHtmlHeader(node.get("htmlHeader").asText());
        }
        if (node.has("htmlFooter")) {
            options = options.withHtmlFooter(node.get("htmlFooter").asText());
        }
        if (node.has("amountClass")) {
            options = options.withAmountClass(node.get("amountClass").asText());
        }
        if (node.has("seasoningsClass")) {
            options = options.withSeasoningsClass(node.get("seasoningsClass").asText());
        }
        if (node.has("ingredientClass")) {
            options = options.withIngredientClass(node.get("ingredientClass").asText());
        }
        if (node.has("actionClass")) {
            options = options.withActionClass(node.get("actionClass").asText());
        }
        if (node.has("doneClass")) {
            options = options.withDoneClass(node.get("doneClass").asText());
        }
        return options;
    }
}
