package com.datapulse.etl.spreadsheet;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.model.FieldError;
import com.datapulse.etl.model.RawLibrairie;
import com.datapulse.etl.model.RecordMetadata;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.datapulse.etl.spreadsheet.LibrairieColumns.*;

/**
 * Imports the partner bookshop spreadsheet into bronze records.
 *
 * The file is checked as a whole first; a structural problem aborts the import before any
 * row is read. Rows failing validation are skipped and their errors collected.
 */
@Slf4j
public class LibrairieImporter {

    private final SpreadsheetReader reader;
    private final SpreadsheetValidator validator;

    public LibrairieImporter(SpreadsheetReader reader, SpreadsheetValidator validator) {
        this.reader = reader;
        this.validator = validator;
    }

    /**
     * @throws StructuralImportException if the file is missing, has the wrong extension,
     *                                   lacks a column or has no rows
     */
    public ImportResult importFile(Path path, String batchId, CancellationToken token) {
        validator.validateLocation(path).orThrow();
        SheetContents contents = reader.read(path);
        FileValidation structure = validator.validateStructure(contents);
        structure.orThrow();

        String source = path.getFileName().toString();
        LocalDateTime importedAt = LocalDateTime.now();
        List<RawLibrairie> accepted = new ArrayList<>();
        List<FieldError> fieldErrors = new ArrayList<>();
        int invalid = 0;

        for (SpreadsheetRow row : contents.rows()) {
            token.throwIfCancelled();

            List<FieldError> errors = validator.validateRow(row);
            if (!errors.isEmpty()) {
                invalid++;
                fieldErrors.addAll(errors);
                log.warn("Skipping row {}: {}", row.rowNumber(), errors);
                continue;
            }
            accepted.add(toRaw(row, new RecordMetadata(source, importedAt, batchId)));
        }

        log.info("Imported {}: {} rows accepted, {} rejected", source, accepted.size(), invalid);
        return new ImportResult(accepted, contents.rows().size(), invalid, fieldErrors, structure.extraColumns());
    }

    private RawLibrairie toRaw(SpreadsheetRow row, RecordMetadata metadata) {
        return RawLibrairie.builder()
                .rowNumber(row.rowNumber())
                .name(row.text(NAME))
                .address(row.text(ADDRESS))
                .postcode(SpreadsheetValidator.postcode(row))
                .city(row.text(CITY))
                .contactName(emptyToNull(row.text(CONTACT_NAME)))
                .contactEmail(emptyToNull(row.text(CONTACT_EMAIL)))
                .contactPhone(emptyToNull(row.text(CONTACT_PHONE)))
                .annualRevenue(row.number(ANNUAL_REVENUE))
                .partnershipDate(row.date(PARTNERSHIP_DATE))
                .specialty(emptyToNull(row.text(SPECIALTY)))
                .metadata(metadata)
                .build();
    }

    private static String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
