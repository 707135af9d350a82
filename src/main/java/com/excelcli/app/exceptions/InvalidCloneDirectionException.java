package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when a clone marker is not followed by exactly one of {@code < > ^ v}.
 */
public class InvalidCloneDirectionException extends TableException {
    public InvalidCloneDirectionException(SourceLocation location, String message) {
        super("INVALID_CLONE_DIRECTION", location, message);
    }
}
