package org.ppvariant.compiler.model;

/**
 * A single token from the source text.
 *
 * @param type The kind of the token.
 * @param text The exact source text of the token.
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 * @param fileName The file the token was read from.
 */
public record Token(TokenType type, String text, int line, int column, String fileName) {

    /**
     * Creates a token without a source location. Used for synthesized token streams.
     * @param type The kind of the token.
     * @param text The source text.
     * @return A token located at line 0, column 0 of an unnamed file.
     */
    public static Token of(TokenType type, String text) {
        return new Token(type, text, 0, 0, "");
    }

    /**
     * Formats the source location as {@code file:line:column}.
     * @return The location string.
     */
    public String location() {
        return fileName + ":" + line + ":" + column;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')";
    }
}
