package com.componenttracker.service;

import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.RawRecord;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the first sheet of an .xlsx or .xls workbook; the first row supplies the field names.
 */
@Component
public class ExcelPayloadDecoder implements PayloadDecoder {

    @Override
    public boolean supports(PayloadFormat format) {
        return format == PayloadFormat.EXCEL;
    }

    @Override
    public List<RawRecord> decode(byte[] payload) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(payload))) {
            if (workbook.getNumberOfSheets() == 0) {
                return List.of();
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return List.of();
            }
            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                Object value = cellValue(headerRow.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
                headers.add(value == null ? null : value.toString().trim());
            }

            List<RawRecord> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                // data row index relative to the header, gaps included
                int rowNumber = r - headerRow.getRowNum();
                Map<String, Object> values = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    String header = headers.get(c);
                    if (header == null || header.isEmpty()) {
                        continue;
                    }
                    values.put(header, cellValue(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)));
                }
                RawRecord raw = new RawRecord(rowNumber, values);
                if (!raw.isBlank()) {
                    rows.add(raw);
                }
            }
            return rows;
        } catch (IOException | RuntimeException e) {
            throw new FatalDecodeException("Failed to process Excel file: " + e.getMessage(), e);
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                yield plainNumber(cell.getNumericCellValue());
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }

    // 2024.0 -> "2024", 1.5 -> "1.5"
    private static String plainNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
