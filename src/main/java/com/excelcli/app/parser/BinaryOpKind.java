package com.excelcli.app.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Binary arithmetic operators with their symbol and precedence level.
 * Level 0 binds loosest (+ -), level 1 binds tighter (* / ^).
 */
public enum BinaryOpKind {
    ADD("+", 0, (lhs, rhs) -> lhs + rhs),
    SUB("-", 0, (lhs, rhs) -> lhs - rhs),
    MUL("*", 1, (lhs, rhs) -> lhs * rhs),
    // IEEE division: x/0 is a signed infinity, 0/0 is NaN
    DIV("/", 1, (lhs, rhs) -> lhs / rhs),
    POW("^", 1, BinaryOpKind::power);

    public static final int MAX_PRECEDENCE = 1;

    private static final Map<String, BinaryOpKind> BY_SYMBOL = new HashMap<>();

    static {
        for (BinaryOpKind op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    private final String symbol;
    private final int precedence;
    private final DoubleBinaryOperator function;

    BinaryOpKind(String symbol, int precedence, DoubleBinaryOperator function) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.function = function;
    }

    /**
     * Looks up the operator written as {@code symbol}, or returns null when
     * the text is not a binary operator.
     */
    public static BinaryOpKind fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public double apply(double lhs, double rhs) {
        return function.applyAsDouble(lhs, rhs);
    }

    /**
     * Raises {@code base} to the integer truncation of {@code exponent} by repeated squaring.
     * The fractional part of the exponent is discarded. A negative truncated exponent
     * yields the reciprocal of the positive power.
     */
    static double power(double base, double exponent) {
        long n = (long) exponent;
        boolean negative = n < 0;
        // For Long.MIN_VALUE the negation overflows back to itself; the unsigned shift below
        // still reads it as 2^63.
        long remaining = negative ? -n : n;
        double result = 1;
        double square = base;
        while (remaining != 0) {
            if ((remaining & 1) != 0) {
                result *= square;
            }
            square *= square;
            remaining >>>= 1;
        }
        return negative ? 1 / result : result;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
