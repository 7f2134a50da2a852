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
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParquetTableDecoderTest {

    @TempDir
    Path dir;

    @Test
    void restoresOriginalColumnNamesAndTypes() throws Exception {
        Table source = Table.builder("Listing ID", "Price", "Neighborhood")
                .addRow(1L, 120.5, "Downtown")
                .addRow(2L, null, "Harbor")
                .build();
        Path file = dir.resolve("listings.parquet");
        write(source, file);

        Table t = TableReaders.read(file);

        assertEquals(source.columns(), t.columns());
        assertEquals(source, t);
        assertEquals(1L, t.value(0, "Listing ID"));
        assertNull(t.value(1, "Price"));
    }

    @Test
    void plainAvroFieldNamesAreUsedWhenNoColumnPropertyExists() throws Exception {
        Schema schema = Schema.createRecord("Plain", null, "test", false);
        schema.setFields(List.of(
                new Schema.Field("id", Schema.create(Schema.Type.INT), null, (Object) null),
                new Schema.Field("name", Schema.create(Schema.Type.STRING), null, (Object) null)));
        Path file = dir.resolve("plain.parquet");

        try (ParquetWriter<GenericRecord> w = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(file))
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                .build()) {
            GenericRecord r = new GenericData.Record(schema);
            r.put("id", 7);
            r.put("name", "seven");
            w.write(r);
        }

        Table t = TableReaders.read(file);

        assertEquals(List.of("id", "name"), t.columns());
        assertEquals(7L, t.value(0, "id"));
        assertEquals("seven", t.value(0, "name"));
    }

    @Test
    void sanitizedFieldNamesStayUnique() {
        Table t = Table.builder("a b", "a-b", "1st").build();

        Schema schema = ParquetColumns.schemaFor(t);

        assertEquals("a_b", schema.getFields().get(0).name());
        assertEquals("a_b_2", schema.getFields().get(1).name());
        assertEquals("_1st", schema.getFields().get(2).name());
        assertEquals("a-b", ParquetColumns.columnName(schema.getFields().get(1)));
    }

    static void write(Table table, Path file) throws Exception {
        Schema schema = ParquetColumns.schemaFor(table);
        try (ParquetWriter<GenericRecord> w = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(file))
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                .build()) {
            for (int r = 0; r < table.rowCount(); r++) {
                GenericRecord rec = new GenericData.Record(schema);
                for (int c = 0; c < table.columnCount(); c++) {
                    Schema.Field f = schema.getFields().get(c);
                    Schema.Type type = ParquetColumns.unwrapNullable(f.schema()).getType();
                    rec.put(c, ParquetColumns.toAvro(table.value(r, c), type));
                }
                w.write(rec);
            }
        }
    }
}
