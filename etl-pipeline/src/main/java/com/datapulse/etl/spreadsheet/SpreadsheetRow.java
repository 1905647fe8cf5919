package com.datapulse.etl.spreadsheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * One data row keyed by header name. Cell values are {@link String}, {@link Double},
 * {@link LocalDate} or {@link Boolean}; empty cells are absent.
 *
 * @param rowNumber 1-based row number as shown by a spreadsheet application
 */
public record SpreadsheetRow(int rowNumber, Map<String, Object> cells) {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"));

    public Object value(String column) {
        return cells.get(column);
    }

    /** Cell as trimmed text, "" when empty. Whole numbers lose their ".0". */
    public String text(String column) {
        Object value = cells.get(column);
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            return d == Math.rint(d) && !Double.isInfinite(d)
                    ? String.valueOf((long) d)
                    : BigDecimal.valueOf(d).toPlainString();
        }
        return value.toString().trim();
    }

    /** Numeric cell, or a text cell holding a number; null otherwise. */
    public Double number(String column) {
        Object value = cells.get(column);
        if (value instanceof Double) {
            return (Double) value;
        }
        String text = text(column).replace(" ", "").replace("\u00A0", "").replace(',', '.');
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Date cell, or a text cell in ISO or dd/MM/yyyy form; null otherwise. */
    public LocalDate date(String column) {
        Object value = cells.get(column);
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        String text = text(column);
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return null;
    }

    public boolean isBlank() {
        return cells.values().stream().allMatch(v -> v == null || v.toString().isBlank());
    }
}
