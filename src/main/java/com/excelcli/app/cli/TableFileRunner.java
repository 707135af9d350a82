package com.excelcli.app.cli;

import com.excelcli.app.exceptions.TableException;
import com.excelcli.app.models.TableResult;
import com.excelcli.app.services.TableRenderer;
import com.excelcli.app.services.TableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnNotWebApplication;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Batch entry point: {@code excel-cli <input.csv>}.
 * Evaluates the file and prints the rendered table to stdout. Any failure is reported
 * on stderr as a single "path:row:col: ERROR: message" line and yields exit code 1.
 * Only active when the application runs without a web server.
 */
@Component
@ConditionalOnNotWebApplication
public class TableFileRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TableFileRunner.class);

    private final TableService tableService;
    private final TableRenderer tableRenderer;
    private int exitCode = 0;

    public TableFileRunner(TableService tableService, TableRenderer tableRenderer) {
        this.tableService = tableService;
        this.tableRenderer = tableRenderer;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            System.err.println("Usage: excel-cli <input.csv>");
            System.err.println("ERROR: input file is not provided");
            exitCode = 1;
            return;
        }

        Path input = Paths.get(files.get(0));
        try {
            TableResult result = tableService.evaluateFile(input);
            System.out.print(tableRenderer.render(result));
        } catch (TableException ex) {
            log.debug("Evaluation of {} failed with {}", input, ex.getCode());
            System.err.println(ex.toDiagnostic(input.toString()));
            exitCode = 1;
        } catch (IOException ex) {
            System.err.println("ERROR: could not read " + input + ": " + ex.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
