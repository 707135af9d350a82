package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown for a malformed formula: a missing operand, an unclosed parenthesis,
 * a bad cell reference or tokens left over after the expression.
 */
public class ParseException extends TableException {
    public ParseException(SourceLocation location, String message) {
        super("PARSE_ERROR", location, message);
    }
}
