package dev.recipeflow.render;

import dev.recipeflow.model.*;

import java.util.List;

/**
 * Prints a parsed recipe back as canonical source text, one rule per line.
 */
public final class RecipePrinter {

    private final RecipeStore store;

    public RecipePrinter(RecipeStore store) {
        this.store = store;
    }

    public String print(Recipe recipe) {
        var sb = new StringBuilder();
        sb.append(store.text(recipe.name())).append(" {\n");
        for (RuleRef ref : recipe.rules()) {
            Rule rule = store.rule(ref);
            sb.append("  ").append(input(rule.input()));
            for (Action action : rule.actions()) {
                sb.append(" -> ").append(action(action));
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    public String input(Input input) {
        if (input instanceof Input.Join join) {
            return store.text(join.point());
        }
        return ingredients(((Input.Ingredients) input).list());
    }

    public String action(Action action) {
        if (action instanceof Action.Step step) {
            return step(step);
        } else if (action instanceof Action.Join join) {
            return store.text(join.point());
        }
        return "<>";
    }

    public String step(Action.Step step) {
        String name = store.text(step.name());
        if (step.seasonings().isEmpty()) {
            return name;
        }
        return name + " & " + ingredients(step.seasonings());
    }

    public String ingredients(List<IngredientRef> refs) {
        var parts = new String[refs.size()];
        for (int i = 0; i < refs.size(); i++) {
            parts[i] = ingredient(refs.get(i));
        }
        return String.join(" + ", parts);
    }

    public String ingredient(IngredientRef ref) {
        Ingredient ingredient = store.ingredient(ref);
        String name = store.text(ingredient.name());
        if (ingredient.hasAmount()) {
            return "[" + store.text(ingredient.amount()) + "] " + name;
        }
        return name;
    }
}
