package com.excelcli.app.cli;

import com.excelcli.app.AppApplication;
import com.excelcli.app.config.ExcelCliProperties;
import com.excelcli.app.services.TableReader;
import com.excelcli.app.services.TableRenderer;
import com.excelcli.app.services.TableService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the batch entry point against real files, capturing stdout and stderr.
 */
@ExtendWith(OutputCaptureExtension.class)
class TableFileRunnerTest {

    @TempDir
    Path dir;

    private TableFileRunner runner;

    @BeforeEach
    void setUp() {
        ExcelCliProperties properties = new ExcelCliProperties();
        TableService tableService = new TableService(new TableReader(properties), properties);
        runner = new TableFileRunner(tableService, new TableRenderer());
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testPrintsRenderedTable(CapturedOutput output) throws IOException {
        Path input = write("input.csv", "x | 1\ny | =B1*3\n");

        runner.run(new DefaultApplicationArguments(input.toString()));

        assertEquals(0, runner.getExitCode());
        assertTrue(output.getOut().contains("x | 1\ny | 3\n"));
    }

    @Test
    void testReportsDiagnosticWithFileLocation(CapturedOutput output) throws IOException {
        Path input = write("broken.csv", "1 | 2\n3 | =A1 + q1\n");

        runner.run(new DefaultApplicationArguments(input.toString()));

        assertEquals(1, runner.getExitCode());
        assertTrue(output.getErr().contains(input + ":2:11: ERROR: "), output.getErr());
    }

    @Test
    void testMissingArgumentPrintsUsage(CapturedOutput output) {
        runner.run(new DefaultApplicationArguments());

        assertEquals(1, runner.getExitCode());
        assertTrue(output.getErr().contains("Usage: excel-cli <input.csv>"));
        assertTrue(output.getErr().contains("ERROR: input file is not provided"));
    }

    @Test
    void testUnreadableFile(CapturedOutput output) {
        Path missing = dir.resolve("missing.csv");

        runner.run(new DefaultApplicationArguments(missing.toString()));

        assertEquals(1, runner.getExitCode());
        assertTrue(output.getErr().contains("ERROR: could not read " + missing));
    }

    /**
     * Boots the application the way main() does in batch mode: stdout holds the table and nothing else.
     */
    @Test
    void testBatchRunPrintsOnlyTable(CapturedOutput output) throws IOException {
        Path input = write("input.csv", "x | 1\ny | =B1*3\n");

        SpringApplication application = new SpringApplication(AppApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setMainApplicationClass(AppApplication.class);
        try (ConfigurableApplicationContext context = application.run(input.toString())) {
            assertEquals(0, SpringApplication.exit(context));
        }

        assertEquals("x | 1\ny | 3\n", output.getOut());
    }
}
