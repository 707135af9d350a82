package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Signals internal corruption: a state that the evaluator presumes unreachable,
 * such as a clone cell that is marked evaluated but was never resolved.
 */
public class InvariantViolationException extends TableException {
    public InvariantViolationException(SourceLocation location, String message) {
        super("INVARIANT_VIOLATION", location, message);
    }
}
