package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when a formula or clone cell is reached again while it is still being evaluated
 * (e.g., a cell referencing itself, or a multi-cell loop).
 */
public class CircularReferenceException extends TableException {
    public CircularReferenceException(SourceLocation location, String message) {
        super("CIRCULAR_REFERENCE", location, message);
    }
}
