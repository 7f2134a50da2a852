/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * First sheet of an .xlsx or .xls workbook; its first row is the header.
 */
public final class ExcelTableDecoder implements TableDecoder {

    private final DataFormatter formatter = new DataFormatter();

    @Override
    public Table decode(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new ValidationException("Workbook has no sheets: " + file);
            }
            final Sheet sheet = workbook.getSheetAt(0);
            final Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new ValidationException("No header row in " + file);
            }

            final List<String> header = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                final Cell cell = headerRow.getCell(c);
                header.add(cell == null ? "Unnamed: " + c : formatter.formatCellValue(cell).trim());
            }

            final DecodedColumns columns = new DecodedColumns(header);
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                final Row row = sheet.getRow(r);
                if (row == null) continue;

                final List<Object> values = new ArrayList<>(header.size());
                boolean blank = true;
                for (int c = 0; c < header.size(); c++) {
                    final Object v = cellValue(row.getCell(c));
                    blank &= (v == null);
                    values.add(v);
                }
                if (!blank) columns.addRow(values);
            }
            return columns.toTable();
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) return null;
        final CellType type = (cell.getCellType() == CellType.FORMULA)
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                return cell.getNumericCellValue();
            case STRING:
                final String s = cell.getStringCellValue();
                return s.isBlank() ? null : s;
            case BOOLEAN:
                return Boolean.toString(cell.getBooleanCellValue());
            case BLANK:
            case ERROR:
            default:
                return null;
        }
    }
}
