package com.excelcli.app.parser;

import java.util.function.DoubleUnaryOperator;

/**
 * Prefix operators. Negation is the only one.
 */
public enum UnaryOpKind {
    NEG("-", operand -> -operand);

    private final String symbol;
    private final DoubleUnaryOperator function;

    UnaryOpKind(String symbol, DoubleUnaryOperator function) {
        this.symbol = symbol;
        this.function = function;
    }

    public String getSymbol() {
        return symbol;
    }

    public double apply(double operand) {
        return function.applyAsDouble(operand);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
