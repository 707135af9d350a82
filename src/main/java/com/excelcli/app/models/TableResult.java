package com.excelcli.app.models;

import java.util.List;

/**
 * A fully evaluated table, ready to be rendered or returned as JSON.
 * Values are stored row-major.
 */
public class TableResult {
    private final String label;
    private final int rows;
    private final int cols;
    private final List<List<CellValue>> values;

    public TableResult(String label, int rows, int cols, List<List<CellValue>> values) {
        this.label = label;
        this.rows = rows;
        this.cols = cols;
        this.values = values;
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
    public List<List<CellValue>> getValues() {
        return values;
    }

    /**
     * Value at a 0-based grid position.
     */
    public CellValue get(int row, int col) {
        return values.get(row).get(col);
    }
}
