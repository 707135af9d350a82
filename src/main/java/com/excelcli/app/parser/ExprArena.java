package com.excelcli.app.parser;

import com.excelcli.app.exceptions.InvariantViolationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only store of every expression node allocated during one run.
 * Nodes are addressed by the int index returned from {@link #add(Expr)}
 * and are never removed or replaced.
 */
public class ExprArena {

    private final List<Expr> nodes = new ArrayList<>();

    /**
     * Appends a node and returns its index.
     */
    public int add(Expr expr) {
        nodes.add(expr);
        return nodes.size() - 1;
    }

    public Expr get(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new InvariantViolationException(null,
                    "expression index " + index + " is outside the arena of " + nodes.size() + " nodes");
        }
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Renders the subtree rooted at {@code index} back into formula syntax,
     * fully parenthesized. Handy for logging and for checking re-based clones.
     */
    public String format(int index) {
        Expr expr = get(index);
        switch (expr.getKind()) {
            case NUMBER:
                double value = expr.getNumber();
                return value == Math.rint(value) && Math.abs(value) < 1e15
                        ? Long.toString((long) value)
                        : Double.toString(value);
            case CELL_REF:
                return cellName(expr.getRow(), expr.getCol());
            case BINARY_OP:
                return "(" + format(expr.getLhs()) + " " + expr.getBinaryOp() + " " + format(expr.getRhs()) + ")";
            case UNARY_OP:
                return expr.getUnaryOp() + format(expr.getOperand());
            default:
                throw new InvariantViolationException(expr.getLocation(), "unknown expression kind " + expr.getKind());
        }
    }

    /**
     * Spreadsheet name of a 0-based grid position: (0, 0) is "A1", (2, 1) is "B3".
     * Positions that no single-letter reference can spell are written as R{row}C{col}.
     */
    public static String cellName(int row, int col) {
        if (row < 0 || col < 0 || col >= 26) {
            return "R" + (row + 1) + "C" + (col + 1);
        }
        return String.valueOf((char) ('A' + col)) + (row + 1);
    }
}
