/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Single-sheet workbook with a bold header row. Numbers are written as numeric cells.
 */
public final class ExcelTableEncoder implements TableEncoder {

    static final String SHEET_NAME = "Sheet1";

    private static final int MAX_COLUMN_CHARS = 60;

    private final boolean legacy;

    /**
     * @param legacy {@code true} for the binary .xls format, {@code false} for .xlsx
     */
    public ExcelTableEncoder(boolean legacy) {
        this.legacy = legacy;
    }

    @Override
    public void encode(Table table, Path file) throws IOException {
        try (Workbook workbook = legacy ? new HSSFWorkbook() : new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(file)) {

            final SpreadsheetVersion version = workbook.getSpreadsheetVersion();
            if (table.rowCount() + 1 > version.getMaxRows() || table.columnCount() > version.getMaxColumns()) {
                throw new IOException("Table of " + table.rowCount() + " rows x " + table.columnCount()
                        + " columns does not fit a " + version + " sheet");
            }

            final Sheet sheet = workbook.createSheet(SHEET_NAME);
            final CellStyle headerStyle = createHeaderStyle(workbook);
            final int[] widths = new int[table.columnCount()];

            final Row header = sheet.createRow(0);
            for (int c = 0; c < table.columnCount(); c++) {
                final Cell cell = header.createCell(c);
                cell.setCellValue(table.columns().get(c));
                cell.setCellStyle(headerStyle);
                widths[c] = table.columns().get(c).length();
            }

            for (int r = 0; r < table.rowCount(); r++) {
                final Row row = sheet.createRow(r + 1);
                final Object[] values = table.rowValues(r);
                for (int c = 0; c < values.length; c++) {
                    final Object v = values[c];
                    if (v == null) continue;
                    final Cell cell = row.createCell(c);
                    if (v instanceof Number n) {
                        cell.setCellValue(n.doubleValue());
                    } else {
                        cell.setCellValue(v.toString());
                    }
                    widths[c] = Math.max(widths[c], ColumnTypes.asText(v).length());
                }
            }

            // character-count widths; autoSizeColumn needs AWT font metrics
            for (int c = 0; c < widths.length; c++) {
                sheet.setColumnWidth(c, (Math.min(widths[c], MAX_COLUMN_CHARS) + 2) * 256);
            }

            workbook.write(out);
        }
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        final CellStyle style = workbook.createCellStyle();
        final Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        return style;
    }
}
