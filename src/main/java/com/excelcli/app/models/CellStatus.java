package com.excelcli.app.models;

/**
 * Evaluation progress of a cell. Moves only forward:
 * UNEVALUATED, then IN_PROGRESS, then EVALUATED.
 * Reaching an IN_PROGRESS cell again means a circular reference.
 */
public enum CellStatus {
    UNEVALUATED,
    IN_PROGRESS,
    EVALUATED
}
