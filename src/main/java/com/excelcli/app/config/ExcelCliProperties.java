package com.excelcli.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the "excel-cli" prefix of application.properties.
 */
@ConfigurationProperties(prefix = "excel-cli")
public class ExcelCliProperties {

    // Deepest nesting allowed while parsing or evaluating before the run is aborted
    private int maxDepth = 2000;

    // Separator between cells within a row
    private String delimiter = "|";

    public int getMaxDepth() {
        return maxDepth;
    }
    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
    public String getDelimiter() {
        return delimiter;
    }
    public void setDelimiter(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("excel-cli.delimiter must not be empty");
        }
        this.delimiter = delimiter;
    }
}
