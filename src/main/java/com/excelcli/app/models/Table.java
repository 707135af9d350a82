package com.excelcli.app.models;

import com.excelcli.app.exceptions.InvariantViolationException;

/**
 * Represents an entire table:
 * - a label naming its source (file path or request), used only in diagnostics
 * - a rows x cols grid of cells, sized once before it is populated
 */
public class Table {

    private final String label;
    private final int rows;
    private final int cols;
    private final Cell[][] cells;

    public Table(String label, int rows, int cols) {
        this.label = label;
        this.rows = rows;
        this.cols = cols;
        this.cells = new Cell[rows][cols];
    }

    public String getLabel() {
        return label;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /**
     * True when (row, col) lies inside the grid.
     */
    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public Cell getCell(int row, int col) {
        checkBounds(row, col);
        return cells[row][col];
    }

    public void setCell(int row, int col, Cell cell) {
        checkBounds(row, col);
        cells[row][col] = cell;
    }

    private void checkBounds(int row, int col) {
        if (!contains(row, col)) {
            throw new InvariantViolationException(null,
                    "cell (" + row + ", " + col + ") is outside the " + rows + "x" + cols + " table " + label);
        }
    }
}
