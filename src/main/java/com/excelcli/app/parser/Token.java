package com.excelcli.app.parser;

/**
 * One lexical unit of a formula: the raw text span and where it starts.
 * The kind of a token is implied by its text; an empty text marks end of input.
 */
public class Token {
    private final String text;
    private final SourceLocation location;

    public Token(String text, SourceLocation location) {
        this.text = text;
        this.location = location;
    }

    public String getText() {
        return text;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean is(String expected) {
        return text.equals(expected);
    }

    @Override
    public String toString() {
        return isEmpty() ? "<end of formula>" : "'" + text + "'";
    }
}
