package com.datapulse.etl.spreadsheet;

import com.datapulse.etl.model.FieldError;
import com.datapulse.etl.model.RawLibrairie;

import java.util.List;

/**
 * Rows accepted from one spreadsheet, plus what was rejected.
 *
 * @param rowsRead    non-empty data rows in the sheet
 * @param invalidRows rows skipped because of at least one field error
 */
public record ImportResult(
        List<RawLibrairie> librairies,
        int rowsRead,
        int invalidRows,
        List<FieldError> fieldErrors,
        List<String> ignoredColumns) {
}
