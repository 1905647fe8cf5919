package com.datapulse.etl.spreadsheet;

import java.util.List;

/**
 * Structural check of a spreadsheet file.
 *
 * @param errors       reasons the file is rejected; empty when valid
 * @param extraColumns unexpected columns, ignored by the import
 */
public record FileValidation(List<String> errors, List<String> extraColumns) {

    public static FileValidation ok(List<String> extraColumns) {
        return new FileValidation(List.of(), List.copyOf(extraColumns));
    }

    public static FileValidation rejected(List<String> errors) {
        return new FileValidation(List.copyOf(errors), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** @throws StructuralImportException when the file is rejected */
    public void orThrow() {
        if (!isValid()) {
            throw new StructuralImportException(errors);
        }
    }
}
