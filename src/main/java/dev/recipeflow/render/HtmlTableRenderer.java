package dev.recipeflow.render;

import dev.recipeflow.config.TableOptions;
import dev.recipeflow.layout.Cell;
import dev.recipeflow.layout.CellContent;
import dev.recipeflow.layout.Grid;

import java.util.List;

/**
 * Writes a {@link Grid} as an HTML {@code <table>}.
 */
public final class HtmlTableRenderer {

    private final TableOptions options;

    public HtmlTableRenderer(TableOptions options) {
        this.options = options;
    }

    public String render(Grid grid) {
        var sb = new StringBuilder();
        if (options.standalone()) {
            sb.append(options.htmlHeader()).append('\n');
        }
        sb.append("<table>\n");
        for (List<Cell> row : grid.rows()) {
            sb.append("  <tr>");
            for (Cell cell : row) {
                sb.append("<td class=\"").append(escape(cssClass(cell.content())))
                  .append("\" rowspan=\"").append(cell.rowSpan())
                  .append("\" colspan=\"").append(cell.colSpan())
                  .append("\">").append(contents(cell.content())).append("</td>");
            }
            sb.append("</tr>\n");
        }
        sb.append("</table>\n");
        if (options.standalone()) {
            sb.append(options.htmlFooter()).append('\n');
        }
        return sb.toString();
    }

    private String cssClass(CellContent content) {
        if (content instanceof CellContent.Ingredient) {
            return options.ingredientClass();
        } else if (content instanceof CellContent.Step) {
            return options.actionClass();
        }
        return options.doneClass();
    }

    private String contents(CellContent content) {
        if (content instanceof CellContent.Ingredient ingredient) {
            return ingredient(ingredient);
        } else if (content instanceof CellContent.Step step) {
            var sb = new StringBuilder(escape(step.name()));
            if (!step.seasonings().isEmpty()) {
                sb.append("<div class=\"").append(escape(options.seasoningsClass())).append("\">");
                for (CellContent.Ingredient seasoning : step.seasonings()) {
                    sb.append(ingredient(seasoning)).append(' ');
                }
                sb.append("</div>");
            }
            return sb.toString();
        }
        return escape("<>");
    }

    private String ingredient(CellContent.Ingredient ingredient) {
        if (!ingredient.hasAmount()) {
            return escape(ingredient.name());
        }
        return "<span class=\"%s\">%s</span> %s".formatted(
            escape(options.amountClass()), escape(ingredient.amount()), escape(ingredient.name()));
    }

    static String escape(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
