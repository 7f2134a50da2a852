/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableWritersTest {

    @TempDir
    Path dir;

    private final Table table = Table.builder("Age Range", "Bill", "Visits", "Note")
            .addRow("0-17", 1250.5, 3L, null)
            .addRow("18-64", 300.0, 1L, "a, \"quoted\" note")
            .build();

    @Test
    void csvQuotesFieldsAndLeavesMissingCellsEmpty() throws Exception {
        Path file = dir.resolve("out.csv");

        TableWriters.write(table, file);

        List<String> lines = Files.readAllLines(file);
        assertEquals("Age Range,Bill,Visits,Note", lines.get(0));
        assertEquals("0-17,1250.5,3,", lines.get(1));
        assertEquals("18-64,300,1,\"a, \"\"quoted\"\" note\"", lines.get(2));
    }

    @Test
    void excelHeaderIsBoldAndNumbersAreNumeric() throws Exception {
        Path file = dir.resolve("out.xlsx");

        TableWriters.write(table, file);

        try (InputStream in = Files.newInputStream(file); Workbook wb = WorkbookFactory.create(in)) {
            Sheet sheet = wb.getSheetAt(0);
            Cell header = sheet.getRow(0).getCell(0);
            assertEquals("Age Range", header.getStringCellValue());
            assertTrue(wb.getFontAt(header.getCellStyle().getFontIndex()).getBold());

            Cell bill = sheet.getRow(1).getCell(1);
            assertEquals(CellType.NUMERIC, bill.getCellType());
            assertEquals(1250.5, bill.getNumericCellValue());
            assertNull(sheet.getRow(1).getCell(3));
        }
    }

    @Test
    void everyFormatReadsBackTheSameTable() throws Exception {
        for (String ext : List.of("csv", "xlsx", "xls", "parquet")) {
            Path file = dir.resolve("round." + ext);

            TableWriters.write(table, file);

            assertEquals(table, TableReaders.read(file), ext);
        }
    }
}
