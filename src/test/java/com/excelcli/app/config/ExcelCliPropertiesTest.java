package com.excelcli.app.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExcelCliPropertiesTest {

    @Test
    void testDefaults() {
        ExcelCliProperties properties = new ExcelCliProperties();

        assertEquals(2000, properties.getMaxDepth());
        assertEquals("|", properties.getDelimiter());
    }

    /**
     * An empty delimiter would never advance the cell split, so it is refused at binding time.
     */
    @Test
    void testEmptyDelimiterRejected() {
        ExcelCliProperties properties = new ExcelCliProperties();

        assertThrows(IllegalArgumentException.class, () -> properties.setDelimiter(""));
        assertThrows(IllegalArgumentException.class, () -> properties.setDelimiter(null));
        assertEquals("|", properties.getDelimiter());

        properties.setDelimiter(";");
        assertEquals(";", properties.getDelimiter());
    }
}
