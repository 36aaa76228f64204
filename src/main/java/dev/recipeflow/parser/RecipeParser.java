package dev.recipeflow.parser;

import dev.recipeflow.model.*;
import dev.recipeflow.parser.RecipeGrammarParser.ActionContext;
import dev.recipeflow.parser.RecipeGrammarParser.FlowContext;
import dev.recipeflow.parser.RecipeGrammarParser.IngredientContext;
import dev.recipeflow.parser.RecipeGrammarParser.IngredientsContext;
import dev.recipeflow.parser.RecipeGrammarParser.NameContext;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses recipe source text into a {@link Recipe}, interning every name and
 * appending ingredients and rules to the given {@link RecipeStore}.
 *
 * <pre>
 * nicer scrambled eggs {
 *   [1/2] onion + [1 clove] garlic
 *     -&gt; chop coarsely -&gt; sautee &amp; butter -&gt; $mix;
 *   [2] eggs -&gt; whisk -&gt; $mix;
 *   $mix -&gt; stir &amp; salt -&gt; &lt;&gt;;
 * }
 * </pre>
 */
public final class RecipeParser {

    private final RecipeStore store;

    public RecipeParser(RecipeStore store) {
        this.store = store;
    }

    /**
     * Parse a single recipe. The whole source must be consumed.
     */
    public Recipe parse(String source) throws RecipeSyntaxException {
        var errors = new SyntaxErrorListener(source);

        var lexer = new RecipeGrammarLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        var parser = new RecipeGrammarParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        RecipeGrammarParser.RecipeContext tree;
        try {
            tree = parser.recipe();
        } catch (ParseCancellationException e) {
            if (e.getCause() instanceof RecipeSyntaxException syntaxError) {
                throw syntaxError;
            }
            throw e;
        }
        return recipe(tree);
    }

    private Recipe recipe(RecipeGrammarParser.RecipeContext ctx) throws RecipeSyntaxException {
        Located name = name(ctx.name());
        var rules = new ArrayList<RuleRef>();
        for (FlowContext flow : ctx.flow()) {
            rules.add(store.addRule(rule(flow)));
        }
        return new Recipe(name, rules);
    }

    private Rule rule(FlowContext ctx) throws RecipeSyntaxException {
        Input input;
        if (ctx.input() instanceof RecipeGrammarParser.JoinInputContext join) {
            input = new Input.Join(located(join.JOIN().getSymbol()));
        } else {
            var list = (RecipeGrammarParser.IngredientInputContext) ctx.input();
            input = new Input.Ingredients(ingredients(list.ingredients()));
        }

        var actions = new ArrayList<Action>();
        for (ActionContext action : ctx.action()) {
            actions.add(action(action));
        }
        return new Rule(input, actions);
    }

    private Action action(ActionContext ctx) throws RecipeSyntaxException {
        if (ctx instanceof RecipeGrammarParser.DoneContext) {
            return new Action.Done();
        }
        if (ctx instanceof RecipeGrammarParser.JoinActionContext join) {
            return new Action.Join(located(join.JOIN().getSymbol()));
        }
        var step = (RecipeGrammarParser.StepContext) ctx;
        Located name = name(step.name());
        List<IngredientRef> seasonings = step.ingredients() != null
            ? ingredients(step.ingredients())
            : List.of();
        return new Action.Step(name, seasonings);
    }

    private List<IngredientRef> ingredients(IngredientsContext ctx) throws RecipeSyntaxException {
        var list = new ArrayList<IngredientRef>();
        for (IngredientContext ingredient : ctx.ingredient()) {
            list.add(ingredient(ingredient));
        }
        return list;
    }

    private IngredientRef ingredient(IngredientContext ctx) throws RecipeSyntaxException {
        Located amount = ctx.AMOUNT() != null ? amount(ctx.AMOUNT().getSymbol()) : null;
        Located name = name(ctx.name());
        return store.addIngredient(new Ingredient(amount, name));
    }

    private Located amount(Token token) throws RecipeSyntaxException {
        String raw = token.getText();
        String text = normalize(raw.substring(1, raw.length() - 1));
        if (text.isEmpty()) {
            throw new RecipeSyntaxException("Empty amount", token.getStartIndex());
        }
        // span covers what is between the brackets
        return new Located(store.intern(text), token.getStartIndex() + 1, token.getStopIndex());
    }

    private Located name(NameContext ctx) {
        List<TerminalNode> words = ctx.WORD();
        var text = new StringBuilder();
        for (TerminalNode word : words) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(word.getText());
        }
        Token first = words.get(0).getSymbol();
        Token last = words.get(words.size() - 1).getSymbol();
        return new Located(store.intern(text.toString()), first.getStartIndex(), last.getStopIndex() + 1);
    }

    private Located located(Token token) {
        return new Located(store.intern(token.getText()), token.getStartIndex(), token.getStopIndex() + 1);
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }
}
