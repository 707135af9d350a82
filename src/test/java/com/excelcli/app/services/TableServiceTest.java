package com.excelcli.app.services;

import com.excelcli.app.config.ExcelCliProperties;
import com.excelcli.app.exceptions.CircularReferenceException;
import com.excelcli.app.exceptions.TableException;
import com.excelcli.app.exceptions.TextInArithmeticException;
import com.excelcli.app.models.CellValue;
import com.excelcli.app.models.TableResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TableService, running the whole read-evaluate pass in memory
 * (no HTTP or external server).
 */
class TableServiceTest {

    private TableService tableService;

    @BeforeEach
    void setUp() {
        ExcelCliProperties properties = new ExcelCliProperties();
        tableService = new TableService(new TableReader(properties), properties);
    }

    /**
     * Literal numbers come back as their floating-point value, text as-is.
     */
    @Test
    void testLiteralValues() {
        TableResult result = tableService.evaluate("t.csv", "42 | -0.5 | 1e2 | hello");

        assertEquals(42.0, result.get(0, 0).getNumber());
        assertEquals(-0.5, result.get(0, 1).getNumber());
        assertEquals(100.0, result.get(0, 2).getNumber());
        assertEquals(CellValue.Kind.TEXT, result.get(0, 3).getKind());
        assertEquals("hello", result.get(0, 3).getText());
    }

    /**
     * Formulas are reported as numbers, with spreadsheet cell names.
     */
    @Test
    void testEvaluateTableData() {
        TableResult result = tableService.evaluate("t.csv",
                "A    | B        | C\n" +
                "1    | 2        | =A2+B2\n" +
                "3    | =A3*2    | :^\n");

        assertEquals(3, result.getRows());
        assertEquals(3, result.getCols());
        assertEquals(3.0, result.get(1, 2).getNumber());
        assertEquals(6.0, result.get(2, 1).getNumber());
        // C3 is C2's formula one row down: A3+B3
        assertEquals(9.0, result.get(2, 2).getNumber());
        assertEquals("C3", result.get(2, 2).getName());
        assertEquals(CellValue.Kind.NUMBER, result.get(2, 2).getKind());
    }

    @Test
    void testThreeCellCycle() {
        CircularReferenceException ex = assertThrows(CircularReferenceException.class, () ->
                tableService.evaluate("t.csv", "=B1 | =C1 | =A1"));
        assertEquals("t.csv:1:1: ERROR: circular reference: cell A1 depends on itself", ex.toDiagnostic("t.csv"));
    }

    @Test
    void testTextReferenceNeverDefaultsToZero() {
        TextInArithmeticException ex = assertThrows(TextInArithmeticException.class, () ->
                tableService.evaluate("t.csv", "n/a | =A1*0"));
        assertTrue(ex.getMessage().contains("A1"));
        assertEquals("TEXT_IN_ARITHMETIC", ex.getCode());
    }

    /**
     * Two independent runs over the same text give identical values.
     */
    @Test
    void testRunsAreIndependentAndRepeatable() {
        String content = "1 | =A1+1 | :< | :<\n:^ | :^ | :^ | =A2/0";
        TableResult first = tableService.evaluate("t.csv", content);
        TableResult second = tableService.evaluate("t.csv", content);

        for (int row = 0; row < first.getRows(); row++) {
            for (int col = 0; col < first.getCols(); col++) {
                assertEquals(first.get(row, col).getDisplay(), second.get(row, col).getDisplay());
            }
        }
        assertEquals("3", first.get(1, 2).getDisplay());
        assertEquals("Infinity", first.get(1, 3).getDisplay());
    }

    @Test
    void testDisplayFormatting() {
        TableResult result = tableService.evaluate("t.csv", "=6/2 | =5/2 | =1/8 | =0-1/8 | =0/0 | =-1/0");

        assertEquals("3", result.get(0, 0).getDisplay());
        assertEquals("2.5", result.get(0, 1).getDisplay());
        assertEquals("0.125", result.get(0, 2).getDisplay());
        assertEquals("-0.125", result.get(0, 3).getDisplay());
        assertEquals("NaN", result.get(0, 4).getDisplay());
        assertEquals("-Infinity", result.get(0, 5).getDisplay());
    }

    @Test
    void testEvaluateFileUsesPathAsLabel(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("input.csv");
        Files.write(input, "1 | =A1+1\n".getBytes(StandardCharsets.UTF_8));

        TableResult result = tableService.evaluateFile(input);
        assertEquals(input.toString(), result.getLabel());
        assertEquals(2.0, result.get(0, 1).getNumber());
    }

    @Test
    void testEmptyTable() {
        TableResult result = tableService.evaluate("t.csv", "");
        assertEquals(0, result.getRows());
        assertTrue(result.getValues().isEmpty());
    }

    @Test
    void testErrorsCarryCodes() {
        TableException ex = assertThrows(TableException.class, () -> tableService.evaluate("t.csv", "=1+"));
        assertEquals("PARSE_ERROR", ex.getCode());
    }
}
