package dev.recipeflow.config;

/**
 * Settings for HTML table output.
 */
public record TableOptions(
    boolean standalone,
    String htmlHeader,
    String htmlFooter,
    String amountClass,
    String seasoningsClass,
    String ingredientClass,
    String actionClass,
    String doneClass
) {
    public static final String DEFAULT_HTML_HEADER = """
        <!DOCTYPE html>
        <html>
          <body>
            <style type="text/css">
              body { font-family: "Fira Sans", arial; }
              td {
                padding: 1em;
              }
              table, td, tr {
                border: 2px solid;
                border-spacing: 0px;
              }
              .ingredient {
                background-color: #ddd;
              }
              .done {
                background-color: #555;
              }
              .amount { color: #555; }
              .seasonings { color: #333; }
            </style>
        """;
    public static final String DEFAULT_HTML_FOOTER = """
          </body>
        </html>
        """;
    public static final String DEFAULT_AMOUNT_CLASS = "amount";
    public static final String DEFAULT_SEASONINGS_CLASS = "seasonings";
    public static final String DEFAULT_INGREDIENT_CLASS = "ingredient";
    public static final String DEFAULT_ACTION_CLASS = "action";
    public static final String DEFAULT_DONE_CLASS = "done";

    public static TableOptions defaults() {
        return new TableOptions(false, DEFAULT_HTML_HEADER, DEFAULT_HTML_FOOTER,
            DEFAULT_AMOUNT_CLASS, DEFAULT_SEASONINGS_CLASS, DEFAULT_INGREDIENT_CLASS,
            DEFAULT_ACTION_CLASS, DEFAULT_DONE_CLASS);
    }

    public TableOptions withStandalone(boolean value) {
        return new TableOptions(value, htmlHeader, htmlFooter, amountClass, seasoningsClass,
            ingredientClass, actionClass, doneClass);
    }

    public TableOptions withHtmlHeader(String value) {
        return new TableOptions(standalone, value, htmlFooter, amountClass, seasoningsClass,
            ingredientClass, actionClass, doneClass);
    }

    public TableOptions withHtmlFooter(String value) {
        return new TableOptions(standalone, htmlHeader, value, amountClass, seasoningsClass,
            ingredientClass, actionClass, doneClass);
    }

    public TableOptions withAmountClass(String value) {
        return new TableOptions(standalone, htmlHeader, htmlFooter, value, seasoningsClass,
            ingredientClass, actionClass, doneClass);
    }

    public TableOptions withSeasoningsClass(String value) {
        return new TableOptions(standalone, htmlHeader, htmlFooter, amountClass, value,
            ingredientClass, actionClass, doneClass);
    }

    public TableOptions withIngredientClass(String value) {
        return new TableOptions(standalone, htmlHeader, htmlFooter, amountClass, seasoningsClass,
            value, actionClass, doneClass);
    }

    public TableOptions withActionClass(String value) {
        return new TableOptions(standalone, htmlHeader, htmlFooter, amountClass, seasoningsClass,
            ingredientClass, value, doneClass);
    }

    public TableOptions withDoneClass(String value) {
        return new TableOptions(standalone, htmlHeader, htmlFooter, amountClass, seasoningsClass,
            ingredientClass, actionClass, value);
    }
}
