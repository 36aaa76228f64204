package dev.recipeflow.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Stops lexing or parsing at the first error. The error is rethrown as a
 * {@link ParseCancellationException} whose cause is the {@link RecipeSyntaxException}.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private final String source;

    SyntaxErrorListener(String source) {
        this.source = source;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        RecipeSyntaxException error;
        if (e instanceof LexerNoViableAltException lexerError) {
            error = lexerError(lexerError.getStartIndex());
        } else if (offendingSymbol instanceof Token token && recognizer instanceof Parser parser) {
            IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
            error = new RecipeSyntaxException(
                "Expected %s but found %s".formatted(describe(expected), describe(token)),
                token.getStartIndex());
        } else {
            error = new RecipeSyntaxException(msg, 0);
        }
        throw new ParseCancellationException(error);
    }

    private RecipeSyntaxException lexerError(int offset) {
        char c = source.charAt(offset);
        String message = switch (c) {
            case '[' -> "Unterminated amount";
            case ']' -> "Unmatched ']'";
            case '$' -> "Expected join point name after '$'";
            case '<' -> "Expected '<>'";
            default -> "Unexpected character '" + c + "'";
        };
        return new RecipeSyntaxException(message, offset);
    }

    private static String describe(IntervalSet expected) {
        List<String> names = new ArrayList<>();
        for (int type : expected.toList()) {
            names.add(describe(type));
        }
        if (names.isEmpty()) {
            return "nothing";
        }
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " or " + names.get(names.size() - 1);
    }

    private static String describe(Token token) {
        return switch (token.getType()) {
            case RecipeGrammarLexer.WORD, RecipeGrammarLexer.JOIN, RecipeGrammarLexer.AMOUNT ->
                "%s '%s'".formatted(describe(token.getType()), token.getText());
            default -> describe(token.getType());
        };
    }

    static String describe(int type) {
        return switch (type) {
            case Token.EOF -> "end of input";
            case RecipeGrammarLexer.LBRACE -> "'{'";
            case RecipeGrammarLexer.RBRACE -> "'}'";
            case RecipeGrammarLexer.SEMI -> "';'";
            case RecipeGrammarLexer.ARROW -> "'->'";
            case RecipeGrammarLexer.PLUS -> "'+'";
            case RecipeGrammarLexer.AMP -> "'&'";
            case RecipeGrammarLexer.DONE -> "'<>'";
            case RecipeGrammarLexer.JOIN -> "join point";
            case RecipeGrammarLexer.AMOUNT -> "amount";
            case RecipeGrammarLexer.WORD -> "name";
            default -> RecipeGrammarLexer.VOCABULARY.getDisplayName(type);
        };
    }
}
