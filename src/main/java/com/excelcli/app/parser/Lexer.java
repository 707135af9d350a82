package com.excelcli.app.parser;

import com.excelcli.app.exceptions.LexException;

/**
 * Splits the text of a single formula into tokens.
 * Recognizes:
 * - number-looking spans (digits and dots, validated later by the parser)
 * - identifier spans (letters, digits, underscore)
 * - the single-character tokens + - * / ^ ( )
 * Whitespace between tokens is skipped. Reaching the end of the text
 * yields an empty token rather than an error.
 */
public class Lexer {

    private static final String SINGLE_CHAR_TOKENS = "+-*/^()";

    private final String source;
    // Location of source.charAt(0) in the input table
    private final SourceLocation origin;
    private int current = 0;
    private Token peeked;

    public Lexer(String source, SourceLocation origin) {
        this.source = source;
        this.origin = origin;
    }

    /**
     * Returns the next token without consuming it.
     */
    public Token peek() {
        if (peeked == null) {
            peeked = scan();
        }
        return peeked;
    }

    /**
     * Consumes and returns the next token.
     */
    public Token next() {
        Token token = peek();
        peeked = null;
        return token;
    }

    private Token scan() {
        while (current < source.length() && Character.isWhitespace(source.charAt(current))) {
            current++;
        }
        int start = current;
        SourceLocation location = origin.shift(start);
        if (current >= source.length()) {
            return new Token("", location);
        }

        char c = source.charAt(current);
        if (isNumberChar(c)) {
            while (current < source.length() && isNumberChar(source.charAt(current))) {
                current++;
            }
        } else if (isIdentifierChar(c)) {
            while (current < source.length() && isIdentifierChar(source.charAt(current))) {
                current++;
            }
        } else if (SINGLE_CHAR_TOKENS.indexOf(c) >= 0) {
            current++;
        } else {
            throw new LexException(location, "unknown token starts with '" + c + "'");
        }
        return new Token(source.substring(start, current), location);
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
