package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when a formula contains a character that starts no valid token.
 */
public class LexException extends TableException {
    public LexException(SourceLocation location, String message) {
        super("LEX_ERROR", location, message);
    }
}
