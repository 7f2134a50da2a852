/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Parquet file through parquet-avro. Column names survive through {@link ParquetColumns}.
 */
public final class ParquetTableEncoder implements TableEncoder {

    private final CompressionCodecName codec;

    public ParquetTableEncoder() {
        this(CompressionCodecName.UNCOMPRESSED);
    }

    public ParquetTableEncoder(CompressionCodecName codec) {
        this.codec = codec;
    }

    @Override
    public void encode(Table table, Path file) throws IOException {
        final Schema schema = ParquetColumns.schemaFor(table);
        final List<Schema.Field> fields = schema.getFields();
        final Schema.Type[] types = new Schema.Type[fields.size()];
        for (int i = 0; i < types.length; i++) {
            types[i] = ParquetColumns.unwrapNullable(fields.get(i).schema()).getType();
        }

        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(file))
                .withSchema(schema)
                .withCompressionCodec(codec)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (int r = 0; r < table.rowCount(); r++) {
                final GenericRecord rec = new GenericData.Record(schema);
                final Object[] row = table.rowValues(r);
                for (int c = 0; c < row.length; c++) {
                    rec.put(c, ParquetColumns.toAvro(row[c], types[c]));
                }
                writer.write(rec);
            }
        }
    }
}
