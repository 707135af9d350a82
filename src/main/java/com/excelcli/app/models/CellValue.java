package com.excelcli.app.models;

import java.math.BigDecimal;

/**
 * The final value of one evaluated cell, either text or a number.
 * Formula cells are reported as numbers.
 */
public class CellValue {

    public enum Kind {
        TEXT,
        NUMBER
    }

    // Outside this range numbers print in scientific notation, e.g. 1E+300
    private static final double PLAIN_UPPER_BOUND = 1e15;
    private static final double PLAIN_LOWER_BOUND = 1e-6;

    private final String name;
    private final Kind kind;
    private final String text;
    private final Double number;

    private CellValue(String name, Kind kind, String text, Double number) {
        this.name = name;
        this.kind = kind;
        this.text = text;
        this.number = number;
    }

    public static CellValue text(String name, String text) {
        return new CellValue(name, Kind.TEXT, text, null);
    }

    public static CellValue number(String name, double number) {
        return new CellValue(name, Kind.NUMBER, null, number);
    }

    // Spreadsheet name of the cell, e.g. "B3"
    public String getName() {
        return name;
    }
    public Kind getKind() {
        return kind;
    }
    public String getText() {
        return text;
    }
    public Double getNumber() {
        return number;
    }

    /**
     * Text as-is; numbers in plain decimal notation without trailing zeros
     * (3, 2.5, -0.125) unless very large or very small (1E+300, 1E-7),
     * and NaN / Infinity / -Infinity for non-finite results.
     */
    public String getDisplay() {
        if (kind == Kind.TEXT) {
            return text;
        }
        double v = number;
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return Double.toString(v);
        }
        BigDecimal decimal = BigDecimal.valueOf(v).stripTrailingZeros();
        double magnitude = Math.abs(v);
        if (magnitude >= PLAIN_UPPER_BOUND || (magnitude != 0 && magnitude < PLAIN_LOWER_BOUND)) {
            return decimal.toString();
        }
        return decimal.toPlainString();
    }

    @Override
    public String toString() {
        return name + "=" + getDisplay();
    }
}
