package com.fdrsentinel.cli;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fdrsentinel.core.model.FlightTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads a CSV flight log (first row is the header) into a {@link FlightTable}.
 * Cells stay text; empty cells become missing.
 *
 * @since 1.0.0
 */
public final class CsvFlightTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvFlightTableLoader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final CsvMapper mapper;

    public CsvFlightTableLoader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * @param path CSV file
     * @return the table
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file is a spreadsheet or has no header
     */
    public FlightTable load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            throw new IllegalArgumentException("Excel input is not supported; export the sheet to CSV: " + path);
        }

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNext()) {
                throw new IllegalArgumentException("Input file is empty: " + path);
            }
            List<String> header = Arrays.stream(rows.next())
                    .map(CsvFlightTableLoader::headerName)
                    .toList();
            List<List<Object>> body = new ArrayList<>();
            while (rows.hasNext()) {
                String[] cells = rows.next();
                if (cells.length == 1 && cells[0].isBlank()) {
                    continue;
                }
                List<Object> row = new ArrayList<>(cells.length);
                for (String cell : cells) {
                    row.add(cell == null || cell.isBlank() ? null : cell);
                }
                body.add(row);
            }
            LOG.info("Loaded {} row(s) x {} column(s) from {}", body.size(), header.size(), path);
            return FlightTable.fromRows(header, body);
        }
    }

    // Excel writes a UTF-8 byte order mark ahead of the first header
    private static String headerName(String raw) {
        String name = raw.startsWith(BYTE_ORDER_MARK) ? raw.substring(1) : raw;
        return name.trim();
    }
}
