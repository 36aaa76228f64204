package dev.recipeflow.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Arenas for the ingredients and rules of one compilation, plus the string
 * interner they refer to. Everything else points into the store through
 * {@link IngredientRef}, {@link RuleRef} and {@link Symbol} handles.
 *
 * <p>The parser populates the store; later stages only read from it.
 */
public final class RecipeStore {

    private final List<Ingredient> ingredients = new ArrayList<>();
    private final List<Rule> rules = new ArrayList<>();
    private final SymbolTable strings = new SymbolTable();

    public IngredientRef addIngredient(Ingredient ingredient) {
        ingredients.add(ingredient);
        return new IngredientRef(ingredients.size() - 1);
    }

    public RuleRef addRule(Rule rule) {
        rules.add(rule);
        return new RuleRef(rules.size() - 1);
    }

    public Symbol intern(String text) {
        return strings.intern(text);
    }

    public Ingredient ingredient(IngredientRef ref) {
        return ingredients.get(ref.index());
    }

    public Rule rule(RuleRef ref) {
        return rules.get(ref.index());
    }

    public String text(Symbol symbol) {
        return strings.resolve(symbol);
    }

    public String text(Located located) {
        return strings.resolve(located.symbol());
    }

    public int ingredientCount() {
        return ingredients.size();
    }

    public int ruleCount() {
        return rules.size();
    }
}
