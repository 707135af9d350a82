package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when a clone cell points at a neighbor outside the table.
 */
public class CloneOutOfBoundsException extends TableException {
    public CloneOutOfBoundsException(SourceLocation location, String message) {
        super("CLONE_OUT_OF_BOUNDS", location, message);
    }
}
