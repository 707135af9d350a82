package com.excelcli.app.parser;

/**
 * An immutable expression node stored in an {@link ExprArena}.
 * Children are referenced by arena index, never by object reference.
 *
 * Which fields are meaningful depends on the {@link ExprKind}:
 * - NUMBER: number
 * - CELL_REF: row, col (0-based grid coordinates, may point outside the table)
 * - BINARY_OP: binaryOp, lhs, rhs
 * - UNARY_OP: unaryOp, operand
 */
public final class Expr {
    private final ExprKind kind;
    private final SourceLocation location;
    private final double number;
    private final int row;
    private final int col;
    private final BinaryOpKind binaryOp;
    private final UnaryOpKind unaryOp;
    private final int lhs;
    private final int rhs;

    private Expr(ExprKind kind, SourceLocation location, double number, int row, int col,
                 BinaryOpKind binaryOp, UnaryOpKind unaryOp, int lhs, int rhs) {
        this.kind = kind;
        this.location = location;
        this.number = number;
        this.row = row;
        this.col = col;
        this.binaryOp = binaryOp;
        this.unaryOp = unaryOp;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static Expr number(double value, SourceLocation location) {
        return new Expr(ExprKind.NUMBER, location, value, -1, -1, null, null, -1, -1);
    }

    public static Expr cellRef(int row, int col, SourceLocation location) {
        return new Expr(ExprKind.CELL_REF, location, 0, row, col, null, null, -1, -1);
    }

    public static Expr binary(BinaryOpKind op, int lhs, int rhs, SourceLocation location) {
        return new Expr(ExprKind.BINARY_OP, location, 0, -1, -1, op, null, lhs, rhs);
    }

    public static Expr unary(UnaryOpKind op, int operand, SourceLocation location) {
        return new Expr(ExprKind.UNARY_OP, location, 0, -1, -1, null, op, operand, -1);
    }

    public ExprKind getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public double getNumber() {
        return number;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public BinaryOpKind getBinaryOp() {
        return binaryOp;
    }

    public UnaryOpKind getUnaryOp() {
        return unaryOp;
    }

    public int getLhs() {
        return lhs;
    }

    public int getRhs() {
        return rhs;
    }

    public int getOperand() {
        return lhs;
    }
}
