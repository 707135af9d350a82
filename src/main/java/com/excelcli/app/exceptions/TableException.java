package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Base class of every failure raised while reading, parsing or evaluating a table.
 * Each one carries a stable error code and the location of the token or cell
 * that triggered it. Any of them aborts the whole run.
 */
public abstract class TableException extends RuntimeException {
    private final String code;
    private final SourceLocation location;

    protected TableException(String code, SourceLocation location, String message) {
        super(message);
        this.code = code;
        this.location = location;
    }

    public String getCode() {
        return code;
    }

    /**
     * Location of the offending token or cell, or null when none is known.
     */
    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Formats the error as "label:row:col: ERROR: message".
     */
    public String toDiagnostic(String label) {
        if (location == null) {
            return label + ": ERROR: " + getMessage();
        }
        return label + ":" + location.getRow() + ":" + location.getCol() + ": ERROR: " + getMessage();
    }
}
