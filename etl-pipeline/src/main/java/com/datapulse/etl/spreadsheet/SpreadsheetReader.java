package com.datapulse.etl.spreadsheet;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the first sheet of an .xlsx or .xls workbook with Apache POI.
 *
 * Row 1 is the header; header names are trimmed and lowercased. Fully empty rows are
 * dropped. Formula cells are read from their cached value.
 */
@Slf4j
public class SpreadsheetReader {

    private final DataFormatter formatter = new DataFormatter(Locale.ROOT);

    public SheetContents read(Path path) {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new SheetContents(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return new SheetContents(List.of(), List.of());
            }

            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                Cell cell = headerRow.getCell(c);
                headers.add(cell == null ? "" : formatter.formatCellValue(cell).trim().toLowerCase(Locale.ROOT));
            }

            List<SpreadsheetRow> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;

                Map<String, Object> cells = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    String header = headers.get(c);
                    if (header.isEmpty()) continue;
                    Object value = cellValue(row.getCell(c));
                    if (value != null) {
                        cells.put(header, value);
                    }
                }
                SpreadsheetRow parsed = new SpreadsheetRow(r + 1, cells);
                if (!parsed.isBlank()) {
                    rows.add(parsed);
                }
            }
            log.info("Read {} data rows from {}", rows.size(), path.getFileName());
            return new SheetContents(headers, rows);

        } catch (IOException | RuntimeException e) {
            throw new StructuralImportException("unreadable workbook " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate();
                }
                return cell.getNumericCellValue();
            case STRING:
                String text = cell.getStringCellValue().trim();
                return text.isEmpty() ? null : text;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }
}
