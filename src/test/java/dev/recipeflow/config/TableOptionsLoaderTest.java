package dev.recipeflow.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableOptionsLoaderTest {

    @Test
    void defaultsMatchStandardClasses() {
        TableOptions options = TableOptions.defaults();

        assertThat(options.standalone()).isFalse();
        assertThat(options.ingredientClass()).isEqualTo("ingredient");
        assertThat(options.actionClass()).isEqualTo("action");
        assertThat(options.doneClass()).isEqualTo("done");
        assertThat(options.amountClass()).isEqualTo("amount");
        assertThat(options.seasoningsClass()).isEqualTo("seasonings");
        assertThat(options.htmlHeader()).contains("<style type=\"text/css\">");
        assertThat(options.htmlFooter()).contains("</html>");
    }

    @Test
    void absentKeysKeepDefaults() throws IOException {
        TableOptions options = TableOptionsLoader.loadFromString("""
            { "standalone": true, "doneClass": "fin" }
            """);

        assertThat(options.standalone()).isTrue();
        assertThat(options.doneClass()).isEqualTo("fin");
        assertThat(options.ingredientClass()).isEqualTo(TableOptions.DEFAULT_INGREDIENT_CLASS);
        assertThat(options.htmlHeader()).isEqualTo(TableOptions.DEFAULT_HTML_HEADER);
    }

    @Test
    void readsEveryKey() throws IOException {
        TableOptions options = TableOptionsLoader.loadFromString("""
            {
              "standalone": false,
              "htmlHeader": "<html><body>",
              "htmlFooter": "</body></html>",
              "amountClass": "amt",
              "seasoningsClass": "sea",
              "ingredientClass": "ing",
              "actionClass": "act",
              "doneClass": "fin"
            }
            """);

        assertThat(options).isEqualTo(new TableOptions(false, "<html><body>", "</body></html>",
            "amt", "sea", "ing", "act", "fin"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("table.json");
        Files.writeString(file, "{ \"actionClass\": \"step\" }");

        assertThat(TableOptionsLoader.loadFromFile(file).actionClass()).isEqualTo("step");
    }

    @Test
    void rejectsNonObjectDocument() {
        assertThatThrownBy(() -> TableOptionsLoader.loadFromString("[1, 2]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> TableOptionsLoader.loadFromString("{ \"standalone\": "))
            .isInstanceOf(IOException.class);
    }
}
