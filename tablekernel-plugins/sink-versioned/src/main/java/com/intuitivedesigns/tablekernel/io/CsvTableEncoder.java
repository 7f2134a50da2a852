/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Header row plus one record per row. Missing cells are written as empty fields.
 */
public final class CsvTableEncoder implements TableEncoder {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();

    @Override
    public void encode(Table table, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            printer.printRecord(table.columns());
            for (int r = 0; r < table.rowCount(); r++) {
                final Object[] row = table.rowValues(r);
                for (Object cell : row) {
                    printer.print(cell == null ? "" : ColumnTypes.asText(cell));
                }
                printer.println();
            }
        }
    }
}
