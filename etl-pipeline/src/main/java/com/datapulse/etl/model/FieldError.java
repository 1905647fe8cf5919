package com.datapulse.etl.model;

/**
 * One failed check on one spreadsheet row.
 */
public record FieldError(int rowNumber, String column, String value, String message) {

    @Override
    public String toString() {
        return "Row " + rowNumber + ": " + column + " " + message
                + (value == null || value.isEmpty() ? "" : " (" + value + ")");
    }
}
