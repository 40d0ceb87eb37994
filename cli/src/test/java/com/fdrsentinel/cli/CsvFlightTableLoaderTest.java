package com.fdrsentinel.cli;

import com.fdrsentinel.core.model.FlightTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CsvFlightTableLoader}.
 */
class CsvFlightTableLoaderTest {

    @TempDir
    Path tempDir;

    private CsvFlightTableLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CsvFlightTableLoader();
    }

    @Test
    @DisplayName("Should read header and cells, treating blanks as missing")
    void shouldLoadCsv() throws Exception {
        Path csv = write("flight.csv",
                " Session Time ,Pitch (deg),Waypoint\n"
                        + "0,1.5,KJFK\n"
                        + "1,,\n"
                        + "\n"
                        + "2,2.5\n");

        FlightTable table = loader.load(csv);

        assertThat(table.getColumnNames()).containsExactly("Session Time", "Pitch (deg)", "Waypoint");
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.requireColumn("Pitch (deg)").numericAt(0)).isEqualTo(1.5);
        assertThat(table.requireColumn("Pitch (deg)").numericAt(1)).isNaN();
        assertThat(table.requireColumn("Waypoint").stringValue(0)).contains("KJFK");
        assertThat(table.requireColumn("Waypoint").stringValue(2)).isEmpty();
    }

    @Test
    @DisplayName("A UTF-8 byte order mark should not become part of the first header")
    void shouldStripByteOrderMark() throws Exception {
        Path csv = write("excel-export.csv", "\uFEFFSession Time,Pitch (deg)\n0,1.5\n1,2.5\n");

        FlightTable table = loader.load(csv);

        assertThat(table.getColumnNames()).containsExactly("Session Time", "Pitch (deg)");
        assertThat(table.requireColumn("Session Time").numericAt(1)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repeated headers should be suffixed instead of rejected")
    void shouldSuffixRepeatedHeaders() throws Exception {
        Path csv = write("repeated.csv", "Session Time,Volts,Volts\n0,12.1,12.4\n");

        FlightTable table = loader.load(csv);

        assertThat(table.getColumnNames()).containsExactly("Session Time", "Volts", "Volts.1");
        assertThat(table.requireColumn("Volts.1").numericAt(0)).isEqualTo(12.4);
    }

    @Test
    @DisplayName("Quoted cells containing commas should stay intact")
    void shouldHonourQuotes() throws Exception {
        Path csv = write("quoted.csv", "Session Time,Note\n0,\"climb, then level\"\n");

        FlightTable table = loader.load(csv);

        assertThat(table.requireColumn("Note").stringValue(0)).contains("climb, then level");
    }

    @Test
    @DisplayName("Spreadsheet files should be rejected")
    void shouldRejectExcel() throws Exception {
        Path xlsx = write("flight.xlsx", "not really a workbook");

        assertThatThrownBy(() -> loader.load(xlsx))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Excel input is not supported");
    }

    @Test
    @DisplayName("An empty file should be rejected")
    void shouldRejectEmptyFile() throws Exception {
        Path csv = write("empty.csv", "");

        assertThatThrownBy(() -> loader.load(csv))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Input file is empty");
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
