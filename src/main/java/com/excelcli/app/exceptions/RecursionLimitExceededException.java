package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when parsing or evaluation nests deeper than the configured maximum depth.
 * Deep parentheses and long reference chains end here instead of overflowing the stack.
 */
public class RecursionLimitExceededException extends TableException {
    public RecursionLimitExceededException(SourceLocation location, String message) {
        super("RECURSION_LIMIT_EXCEEDED", location, message);
    }
}
