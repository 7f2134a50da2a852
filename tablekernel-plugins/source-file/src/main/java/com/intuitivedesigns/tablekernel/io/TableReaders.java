/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads a table from a file, choosing the decoder by extension (case-insensitive).
 */
public final class TableReaders {

    private static final Logger log = LoggerFactory.getLogger(TableReaders.class);

    private static final Map<TableFormat, TableDecoder> DECODERS = new EnumMap<>(TableFormat.class);

    static {
        DECODERS.put(TableFormat.CSV, new CsvTableDecoder());
        DECODERS.put(TableFormat.EXCEL, new ExcelTableDecoder());
        DECODERS.put(TableFormat.PARQUET, new ParquetTableDecoder());
    }

    private TableReaders() {}

    /**
     * @throws com.intuitivedesigns.tablekernel.table.UnsupportedFormatException for an unknown extension
     * @throws FileNotFoundException when the file does not exist
     */
    public static Table read(Path file) throws IOException {
        final TableFormat format = TableFormat.forPath(file);
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Input file not found: " + file);
        }
        final Table table = DECODERS.get(format).decode(file);
        log.debug("Read {} rows x {} columns from {} ({})", table.rowCount(), table.columnCount(), file, format);
        return table;
    }
}
