package org.glyphstack.assembler.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** The ':' character, ending a label definition. */
    COLON,

    /** A mnemonic or label name. */
    IDENTIFIER,
    /** A non-negative decimal literal. */
    NUMBER,

    /** A newline character; instructions are line-oriented. */
    NEWLINE,
    /** Represents the end of the source file. */
    END_OF_FILE
}
