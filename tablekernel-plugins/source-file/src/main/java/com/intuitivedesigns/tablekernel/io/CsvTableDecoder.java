/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Comma separated text with a header row (RFC 4180 quoting).
 */
public final class CsvTableDecoder implements TableDecoder {

    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    @Override
    public Table decode(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            final List<String> header = new ArrayList<>(parser.getHeaderNames());
            if (header.isEmpty()) {
                throw new ValidationException("No header row in " + file);
            }
            if (!header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
                header.set(0, header.get(0).substring(1));
            }

            final DecodedColumns columns = new DecodedColumns(header);
            for (CSVRecord record : parser) {
                final List<Object> row = new ArrayList<>(columns.width());
                for (int i = 0; i < columns.width(); i++) {
                    row.add(record.isSet(i) ? record.get(i) : null);
                }
                columns.addRow(row);
            }
            return columns.toTable();
        } catch (IllegalArgumentException | IllegalStateException e) {
            // commons-csv reports malformed headers and quoting this way
            throw new ValidationException("Malformed CSV file " + file + ": " + e.getMessage());
        }
    }
}
