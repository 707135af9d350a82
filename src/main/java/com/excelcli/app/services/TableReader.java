package com.excelcli.app.services;

import com.excelcli.app.config.ExcelCliProperties;
import com.excelcli.app.exceptions.InvalidCloneDirectionException;
import com.excelcli.app.exceptions.InvariantViolationException;
import com.excelcli.app.models.Cell;
import com.excelcli.app.models.CloneDirection;
import com.excelcli.app.models.Table;
import com.excelcli.app.parser.ExprArena;
import com.excelcli.app.parser.FormulaParser;
import com.excelcli.app.parser.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw table text into a populated {@link Table} in two passes:
 * 1) a sizing pass counts rows and the widest row's cells
 * 2) a population pass classifies every cell and parses formulas into the arena
 *
 * Rows are separated by newlines, cells by the configured delimiter.
 * Rows shorter than the widest one are padded with empty text cells.
 */
@Component
public class TableReader {

    private static final Logger log = LoggerFactory.getLogger(TableReader.class);

    // Decimal literal such as "42", "-3.5", ".5" or "1e3"
    private static final Pattern NUMBER_LITERAL =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private final ExcelCliProperties properties;

    public TableReader(ExcelCliProperties properties) {
        this.properties = properties;
    }

    /**
     * Reads {@code content} into a new table labeled {@code label}.
     * Formula nodes are allocated into {@code arena}.
     */
    public Table read(String label, String content, ExprArena arena) {
        List<String> lines = splitLines(content);
        String delimiter = properties.getDelimiter();

        // 1) Sizing pass
        int rows = lines.size();
        int cols = 0;
        for (String line : lines) {
            cols = Math.max(cols, countCells(line, delimiter));
        }
        log.debug("Sized table {} as {}x{}", label, rows, cols);

        // 2) Population pass
        Table table = new Table(label, rows, cols);
        FormulaParser parser = new FormulaParser(arena, properties.getMaxDepth());
        for (int row = 0; row < rows; row++) {
            String line = lines.get(row);
            int col = 0;
            int start = 0;
            while (true) {
                int end = line.indexOf(delimiter, start);
                String raw = end < 0 ? line.substring(start) : line.substring(start, end);
                table.setCell(row, col, classify(raw, new SourceLocation(row + 1, start + 1), parser));
                col++;
                if (end < 0) {
                    break;
                }
                start = end + delimiter.length();
            }
            for (; col < cols; col++) {
                table.setCell(row, col, Cell.text("", new SourceLocation(row + 1, line.length() + 1)));
            }
        }

        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                if (table.getCell(row, col) == null) {
                    throw new InvariantViolationException(null,
                            "population pass left cell (" + row + ", " + col + ") empty");
                }
            }
        }
        return table;
    }

    /**
     * Decides what a single cell holds:
     * - "=..." is a formula, parsed immediately
     * - ":x" is a clone marker pointing in direction x
     * - a decimal literal is a number
     * - anything else is text, kept verbatim after trimming
     *
     * @param raw         the untrimmed cell text
     * @param cellStart   location of the first character of {@code raw}
     */
    Cell classify(String raw, SourceLocation cellStart, FormulaParser parser) {
        int leading = 0;
        while (leading < raw.length() && Character.isWhitespace(raw.charAt(leading))) {
            leading++;
        }
        String text = raw.trim();
        SourceLocation location = cellStart.shift(leading);

        if (text.startsWith("=")) {
            int root = parser.parse(text.substring(1), location.shift(1));
            return Cell.formula(root, location);
        }
        if (text.startsWith(":")) {
            if (text.length() != 2) {
                throw new InvalidCloneDirectionException(location.shift(1),
                        "clone marker '" + text + "' needs exactly one direction character: <, >, ^ or v");
            }
            CloneDirection direction = CloneDirection.fromSymbol(text.charAt(1));
            if (direction == null) {
                throw new InvalidCloneDirectionException(location.shift(1),
                        "unknown clone direction '" + text.charAt(1) + "', expected <, >, ^ or v");
            }
            return Cell.cloneMarker(direction, location);
        }
        if (NUMBER_LITERAL.matcher(text).matches()) {
            return Cell.number(Double.parseDouble(text), location);
        }
        return Cell.text(text, location);
    }

    private static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content.isEmpty()) {
            return lines;
        }
        for (String line : content.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        // A final newline terminates the last row rather than starting an empty one
        if (content.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static int countCells(String line, String delimiter) {
        int count = 1;
        int index = line.indexOf(delimiter);
        while (index >= 0) {
            count++;
            index = line.indexOf(delimiter, index + delimiter.length());
        }
        return count;
    }
}
