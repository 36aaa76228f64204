package dev.recipeflow.parser;

/**
 * Thrown when recipe source text does not match the recipe grammar.
 */
public class RecipeSyntaxException extends Exception {

    private final int offset;

    public RecipeSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * Character offset into the source where the error was detected.
     */
    public int offset() {
        return offset;
    }
}
