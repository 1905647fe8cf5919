package com.datapulse.etl.spreadsheet;

import com.datapulse.etl.model.FieldError;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.datapulse.etl.spreadsheet.LibrairieColumns.*;

/**
 * Checks the partner spreadsheet at two levels: the file as a whole (any failure rejects
 * the import) and each data row (a failing row is skipped).
 */
@Slf4j
public class SpreadsheetValidator {

    static final Pattern POSTCODE_FORMAT = Pattern.compile("^\\d{5}$");
    static final Pattern EMAIL_FORMAT = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s.\\-]");
    static final Pattern PHONE_NATIONAL = Pattern.compile("^0[1-9]\\d{8}$");
    static final Pattern PHONE_SHORT = Pattern.compile("^[1-9]\\d{8}$");

    private static final List<String> EXTENSIONS = List.of(".xlsx", ".xls");
    private static final List<String> REQUIRED_TEXT = List.of(NAME, ADDRESS, CITY);

    private final SpreadsheetReader reader;

    public SpreadsheetValidator(SpreadsheetReader reader) {
        this.reader = reader;
    }

    /** Existence, extension, readable workbook, expected columns and at least one row. */
    public FileValidation validateFile(Path path) {
        FileValidation location = validateLocation(path);
        if (!location.isValid()) {
            return location;
        }
        try {
            return validateStructure(reader.read(path));
        } catch (StructuralImportException e) {
            return FileValidation.rejected(e.getProblems());
        }
    }

    public FileValidation validateLocation(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return FileValidation.rejected(List.of("File not found: " + path));
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (EXTENSIONS.stream().noneMatch(name::endsWith)) {
            return FileValidation.rejected(List.of("Unsupported extension for " + path.getFileName()
                    + " (expected .xlsx or .xls)"));
        }
        return FileValidation.ok(List.of());
    }

    public FileValidation validateStructure(SheetContents contents) {
        List<String> errors = new ArrayList<>();

        List<String> missing = EXPECTED.stream()
                .filter(column -> !contents.headers().contains(column))
                .toList();
        if (!missing.isEmpty()) {
            errors.add("Missing columns: " + String.join(", ", missing));
        }
        if (contents.rows().isEmpty()) {
            errors.add("Spreadsheet has no data rows");
        }
        if (!errors.isEmpty()) {
            return FileValidation.rejected(errors);
        }

        List<String> extra = contents.headers().stream()
                .filter(h -> !h.isEmpty() && !EXPECTED.contains(h))
                .toList();
        if (!extra.isEmpty()) {
            log.info("Ignoring unexpected columns: {}", extra);
        }
        return FileValidation.ok(extra);
    }

    /** All field errors of the row; empty when the row is valid. */
    public List<FieldError> validateRow(SpreadsheetRow row) {
        List<FieldError> errors = new ArrayList<>();

        for (String column : REQUIRED_TEXT) {
            if (row.text(column).isEmpty()) {
                errors.add(new FieldError(row.rowNumber(), column, "", "is required"));
            }
        }

        String postcode = postcode(row);
        if (postcode.isEmpty()) {
            errors.add(new FieldError(row.rowNumber(), POSTCODE, "", "is required"));
        } else if (!POSTCODE_FORMAT.matcher(postcode).matches()) {
            errors.add(new FieldError(row.rowNumber(), POSTCODE, postcode, "must be 5 digits"));
        }

        String email = row.text(CONTACT_EMAIL);
        if (!email.isEmpty() && !isValidEmail(email)) {
            errors.add(new FieldError(row.rowNumber(), CONTACT_EMAIL, email, "is not a valid email"));
        }

        String phone = row.text(CONTACT_PHONE);
        if (!phone.isEmpty() && !isValidPhone(phone)) {
            errors.add(new FieldError(row.rowNumber(), CONTACT_PHONE, phone, "is not a valid French phone number"));
        }
        return errors;
    }

    public static boolean isValidEmail(String email) {
        return EMAIL_FORMAT.matcher(email.trim()).matches();
    }

    public static boolean isValidPhone(String phone) {
        String digits = PHONE_SEPARATORS.matcher(phone.trim()).replaceAll("");
        return PHONE_NATIONAL.matcher(digits).matches() || PHONE_SHORT.matcher(digits).matches();
    }

    /**
     * Postcode as text. A numeric cell loses its leading zero in the workbook ("01000" is
     * stored as 1000), so four-digit numbers are padded back.
     */
    static String postcode(SpreadsheetRow row) {
        Object value = row.value(POSTCODE);
        String text = row.text(POSTCODE);
        if (value instanceof Double && text.length() == 4) {
            return "0" + text;
        }
        return text;
    }
}
