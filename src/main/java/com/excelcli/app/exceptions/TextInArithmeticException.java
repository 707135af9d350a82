package com.excelcli.app.exceptions;

import com.excelcli.app.parser.SourceLocation;

/**
 * Thrown when a formula references a cell that holds text.
 * The primary location is the reference inside the formula; the text cell's
 * own location is kept alongside it.
 */
public class TextInArithmeticException extends TableException {
    private final SourceLocation textLocation;

    public TextInArithmeticException(SourceLocation location, SourceLocation textLocation, String message) {
        super("TEXT_IN_ARITHMETIC", location, message);
        this.textLocation = textLocation;
    }

    public SourceLocation getTextLocation() {
        return textLocation;
    }
}
