package com.excelcli.app.models;

/**
 * Direction of the neighbor a clone cell copies, with the grid step that reaches it.
 * Written in the input as ":<", ":>", ":^" and ":v".
 */
public enum CloneDirection {
    LEFT('<', 0, -1),
    RIGHT('>', 0, 1),
    UP('^', -1, 0),
    DOWN('v', 1, 0);

    private final char symbol;
    private final int rowStep;
    private final int colStep;

    CloneDirection(char symbol, int rowStep, int colStep) {
        this.symbol = symbol;
        this.rowStep = rowStep;
        this.colStep = colStep;
    }

    /**
     * Maps the marker character to a direction, or returns null for anything else.
     */
    public static CloneDirection fromSymbol(char symbol) {
        for (CloneDirection direction : values()) {
            if (direction.symbol == symbol) {
                return direction;
            }
        }
        return null;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getRowStep() {
        return rowStep;
    }

    public int getColStep() {
        return colStep;
    }
}
