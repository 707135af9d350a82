package com.excelcli.app.models;

import com.excelcli.app.parser.SourceLocation;

/**
 * Represents a single table cell.
 * Stores:
 * - the kind of content (text, number, formula or clone marker) and its payload
 * - the evaluation status, used both as a memo flag and for cycle detection
 * - where the cell starts in the input, for diagnostics
 *
 * A clone cell rewrites its own kind and payload exactly once, when it is resolved.
 */
public class Cell {
    private CellKind kind;
    private CellStatus status = CellStatus.UNEVALUATED;
    private final SourceLocation location;

    private String text;
    // Literal for NUMBER cells, cached result for FORMULA cells
    private double value;
    private int exprIndex = -1;
    private CloneDirection direction;

    private Cell(CellKind kind, SourceLocation location) {
        this.kind = kind;
        this.location = location;
    }

    public static Cell text(String text, SourceLocation location) {
        Cell cell = new Cell(CellKind.TEXT, location);
        cell.text = text;
        return cell;
    }

    public static Cell number(double value, SourceLocation location) {
        Cell cell = new Cell(CellKind.NUMBER, location);
        cell.value = value;
        return cell;
    }

    public static Cell formula(int exprIndex, SourceLocation location) {
        Cell cell = new Cell(CellKind.FORMULA, location);
        cell.exprIndex = exprIndex;
        return cell;
    }

    public static Cell cloneMarker(CloneDirection direction, SourceLocation location) {
        Cell cell = new Cell(CellKind.CLONE, location);
        cell.direction = direction;
        return cell;
    }

    // Basic getters
    public CellKind getKind() {
        return kind;
    }
    public CellStatus getStatus() {
        return status;
    }
    public SourceLocation getLocation() {
        return location;
    }
    public String getText() {
        return text;
    }
    public double getValue() {
        return value;
    }
    public int getExprIndex() {
        return exprIndex;
    }
    public CloneDirection getDirection() {
        return direction;
    }

    public void setStatus(CellStatus status) {
        this.status = status;
    }

    // The cached result of a formula
    public void setValue(double value) {
        this.value = value;
    }

    // Resolution of a clone cell into the kind of the neighbor it copied

    public void resolveToText(String text) {
        this.kind = CellKind.TEXT;
        this.text = text;
        this.direction = null;
    }

    public void resolveToNumber(double value) {
        this.kind = CellKind.NUMBER;
        this.value = value;
        this.direction = null;
    }

    public void resolveToFormula(int exprIndex) {
        this.kind = CellKind.FORMULA;
        this.exprIndex = exprIndex;
        this.direction = null;
    }
}
