package com.datapulse.etl.spreadsheet;

import java.util.List;

/**
 * Header names and data rows of the first sheet of a workbook.
 */
public record SheetContents(List<String> headers, List<SpreadsheetRow> rows) {
}
