package com.excelcli.app.parser;

/**
 * Tag of an {@link Expr} node.
 */
public enum ExprKind {
    NUMBER,
    CELL_REF,
    BINARY_OP,
    UNARY_OP
}
