package com.excelcli.app.controllers;

import com.excelcli.app.models.TableResult;
import com.excelcli.app.services.TableRenderer;
import com.excelcli.app.services.TableService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for evaluating tables.
 * "/table" is the base path. Every request is an independent run.
 */
@RestController
@RequestMapping("/table")
public class TableController {

    @Autowired
    private TableService tableService;

    @Autowired
    private TableRenderer tableRenderer;

    /**
     * POST /table
     * Body: the table as plain text, rows separated by newlines and cells by '|'.
     * Returns the evaluated values as JSON.
     * Malformed tables yield a 400, tables that cannot be evaluated
     * (cycles, text in arithmetic, ...) a 422, via the GlobalExceptionHandler.
     */
    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TableResult> evaluate(@RequestBody String content) {
        return ResponseEntity.ok(tableService.evaluate(TableService.REQUEST_LABEL, content));
    }

    /**
     * POST /table/render
     * Same input as POST /table, but returns the evaluated table as aligned text.
     */
    @PostMapping(value = "/render", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> render(@RequestBody String content) {
        TableResult result = tableService.evaluate(TableService.REQUEST_LABEL, content);
        return ResponseEntity.ok(tableRenderer.render(result));
    }
}
