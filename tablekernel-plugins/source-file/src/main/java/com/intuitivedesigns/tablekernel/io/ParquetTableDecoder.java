/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parquet files read as Avro generic records. Column types come from the file schema.
 */
public final class ParquetTableDecoder implements TableDecoder {

    @Override
    public Table decode(Path file) throws IOException {
        final NioInputFile input = new NioInputFile(file);

        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(input).build()) {
            GenericRecord rec = reader.read();
            if (rec == null) {
                return Table.empty(footerColumns(input));
            }

            final Schema schema = rec.getSchema();
            final List<String> names = new ArrayList<>();
            for (Schema.Field f : schema.getFields()) {
                names.add(ParquetColumns.columnName(f));
            }

            final Table.Builder b = Table.builder(names);
            final int width = names.size();
            while (rec != null) {
                final Object[] row = new Object[width];
                for (int i = 0; i < width; i++) {
                    row[i] = ParquetColumns.fromAvro(rec.get(i));
                }
                b.addRow(row);
                rec = reader.read();
            }
            return b.build();
        }
    }

    /**
     * Column names of a file with no rows, taken from the footer schema.
     */
    private static List<String> footerColumns(NioInputFile input) throws IOException {
        try (ParquetFileReader fr = ParquetFileReader.open(input)) {
            final List<String> names = new ArrayList<>();
            for (org.apache.parquet.schema.Type t : fr.getFooter().getFileMetaData().getSchema().getFields()) {
                names.add(t.getName());
            }
            return names;
        }
    }
}
