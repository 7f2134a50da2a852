/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a table to a file, choosing the encoder by extension.
 */
public final class TableWriters {

    private static final Logger log = LoggerFactory.getLogger(TableWriters.class);

    private TableWriters() {}

    /**
     * @throws com.intuitivedesigns.tablekernel.table.UnsupportedFormatException for an unknown extension
     */
    public static void write(Table table, Path file) throws IOException {
        final String ext = TableFormat.extensionOf(file);
        encoderFor(ext).encode(table, file);
        log.debug("Wrote {} rows x {} columns to {}", table.rowCount(), table.columnCount(), file);
    }

    /**
     * @param extension with or without the leading dot
     */
    public static TableEncoder encoderFor(String extension) {
        final TableFormat format = TableFormat.forExtension(extension);
        switch (format) {
            case CSV:
                return new CsvTableEncoder();
            case EXCEL:
                return new ExcelTableEncoder("xls".equals(TableFormat.normalizeExtension(extension)));
            case PARQUET:
                return new ParquetTableEncoder();
            default:
                throw new IllegalStateException("No encoder for " + format);
        }
    }
}
