package com.excelcli.app.exceptions;

/**
 * Simple DTO to structure error responses with a code, message and location.
 * For example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "circular reference: cell A1 depends on itself",
 *   "row": 1,
 *   "col": 1
 * }
 * row and col are null when the error has no source location.
 */
public class ErrorResponse {
    private String code;
    private String message;
    private Integer row;
    private Integer col;

    public ErrorResponse(String code, String message, Integer row, Integer col) {
        this.code = code;
        this.message = message;
        this.row = row;
        this.col = col;
    }

    public static ErrorResponse of(TableException ex) {
        if (ex.getLocation() == null) {
            return new ErrorResponse(ex.getCode(), ex.getMessage(), null, null);
        }
        return new ErrorResponse(ex.getCode(), ex.getMessage(), ex.getLocation().getRow(), ex.getLocation().getCol());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Integer getRow() {
        return row;
    }

    public Integer getCol() {
        return col;
    }
}
