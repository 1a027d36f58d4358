package org.glyphstack.assembler.lexer;

import org.glyphstack.assembler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a program listing into a sequence of tokens. Comments run from {@code #} to the end
 * of the line; newlines are kept as tokens because the listing is line-oriented.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The listing as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the listing, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire listing.
     * @return The recognized tokens, always ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ':': addToken(TokenType.COLON); break;
            case '#':
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                lineStart = current;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalFileName, line);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            diagnostics.reportError("Invalid number format: " + source.substring(start, current), logicalFileName, line);
            return;
        }
        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(numberString));
        } catch (NumberFormatException e) {
            diagnostics.reportError("Number out of range: " + numberString, logicalFileName, line);
        }
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line, start - lineStart + 1, logicalFileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
