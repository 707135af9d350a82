package com.excelcli.app.services;

import com.excelcli.app.config.ExcelCliProperties;
import com.excelcli.app.exceptions.InvariantViolationException;
import com.excelcli.app.models.Cell;
import com.excelcli.app.models.CellValue;
import com.excelcli.app.models.Table;
import com.excelcli.app.models.TableResult;
import com.excelcli.app.parser.ExprArena;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main business logic: reads a table, evaluates every cell in one pass,
 * and returns the typed results.
 *
 * Each call builds its own table and expression arena, so the service itself
 * holds no state between runs.
 */
@Service
public class TableService {

    public static final String REQUEST_LABEL = "<request>";

    private static final Logger log = LoggerFactory.getLogger(TableService.class);

    private final TableReader tableReader;
    private final ExcelCliProperties properties;

    public TableService(TableReader tableReader, ExcelCliProperties properties) {
        this.tableReader = tableReader;
        this.properties = properties;
    }

    /**
     * Reads and evaluates the file at {@code path}. The path is the diagnostics label.
     */
    public TableResult evaluateFile(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return evaluate(path.toString(), content);
    }

    /**
     * Parses {@code content}, evaluates every cell and returns the values.
     * Any error aborts the run; there are no partial results.
     */
    public TableResult evaluate(String label, String content) {
        ExprArena arena = new ExprArena();
        Table table = tableReader.read(label, content, arena);

        TableEvaluator evaluator = new TableEvaluator(table, arena, properties.getMaxDepth());
        evaluator.evaluateAll();

        TableResult result = toResult(table);
        log.debug("Evaluated {}: {} rows, {} columns", label, result.getRows(), result.getCols());
        return result;
    }

    private TableResult toResult(Table table) {
        List<List<CellValue>> values = new ArrayList<>();
        for (int row = 0; row < table.getRows(); row++) {
            List<CellValue> rowValues = new ArrayList<>();
            for (int col = 0; col < table.getCols(); col++) {
                Cell cell = table.getCell(row, col);
                String name = ExprArena.cellName(row, col);
                switch (cell.getKind()) {
                    case TEXT:
                        rowValues.add(CellValue.text(name, cell.getText()));
                        break;
                    case NUMBER:
                    case FORMULA:
                        rowValues.add(CellValue.number(name, cell.getValue()));
                        break;
                    default:
                        throw new InvariantViolationException(cell.getLocation(),
                                "cell " + name + " is still a clone after evaluation");
                }
            }
            values.add(rowValues);
        }
        return new TableResult(table.getLabel(), table.getRows(), table.getCols(), values);
    }
}
