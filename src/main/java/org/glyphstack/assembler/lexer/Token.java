package org.glyphstack.assembler.lexer;

/**
 * Represents a single token extracted from a listing by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The value of a {@link TokenType#NUMBER} token as a {@link Long}, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the listing.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
}
