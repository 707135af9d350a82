package com.excelcli.app.parser;

import java.util.Objects;

/**
 * A 1-based row/column position inside the input table text.
 * Used by tokens, expression nodes and cells so that every error
 * can point at the exact character that caused it.
 */
public class SourceLocation {
    private final int row;
    private final int col;

    public SourceLocation(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Returns the location {@code offset} characters further along the same line.
     */
    public SourceLocation shift(int offset) {
        return new SourceLocation(row, col + offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceLocation)) {
            return false;
        }
        SourceLocation that = (SourceLocation) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return row + ":" + col;
    }
}
