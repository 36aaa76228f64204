package dev.recipeflow.model;

import java.util.List;

/**
 * A named recipe: an ordered list of rules stored in a {@link RecipeStore}.
 */
public record Recipe(Located name, List<RuleRef> rules) {

    public Recipe {
        rules = List.copyOf(rules);
    }
}
