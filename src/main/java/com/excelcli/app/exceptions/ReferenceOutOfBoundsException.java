package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when a formula references a cell outside the table, for example B9 in a 3x3 table
 * or a re-based clone reference that slid past the first row or column.
 */
public class ReferenceOutOfBoundsException extends TableException {
    public ReferenceOutOfBoundsException(SourceLocation location, String message) {
        super("REFERENCE_OUT_OF_BOUNDS", location, message);
    }
}
