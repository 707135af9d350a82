package com.excelcli.app.models;

/**
 * What a cell holds. CLONE only exists before evaluation; every clone
 * cell turns into one of the other three kinds once it is resolved.
 */
public enum CellKind {
    TEXT,
    NUMBER,
    FORMULA,
    CLONE
}
