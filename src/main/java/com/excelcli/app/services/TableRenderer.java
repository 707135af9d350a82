package com.excelcli.app.services;

import com.excelcli.app.models.CellValue;
import com.excelcli.app.models.TableResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders an evaluated table as aligned text, one line per row, cells joined by " | ".
 * Each column is as wide as its widest value; text is left-aligned, numbers right-aligned.
 */
@Component
public class TableRenderer {

    private static final String SEPARATOR = " | ";

    public String render(TableResult result) {
        int[] widths = columnWidths(result);
        StringBuilder out = new StringBuilder();
        for (List<CellValue> row : result.getValues()) {
            for (int col = 0; col < row.size(); col++) {
                if (col > 0) {
                    out.append(SEPARATOR);
                }
                CellValue value = row.get(col);
                String display = value.getDisplay();
                String padding = " ".repeat(widths[col] - display.length());
                if (value.getKind() == CellValue.Kind.NUMBER) {
                    out.append(padding).append(display);
                } else {
                    out.append(display).append(padding);
                }
            }
            out.append('\n');
        }
        return out.toString();
    }

    /**
     * Width of every column: the length of its longest rendered value.
     */
    public int[] columnWidths(TableResult result) {
        int[] widths = new int[result.getCols()];
        for (List<CellValue> row : result.getValues()) {
            for (int col = 0; col < row.size(); col++) {
                widths[col] = Math.max(widths[col], row.get(col).getDisplay().length());
            }
        }
        return widths;
    }
}
