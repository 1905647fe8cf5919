package com.datapulse.etl.spreadsheet;

import java.util.List;

/**
 * The spreadsheet cannot be imported at all: missing file, wrong extension, missing
 * columns or no data. Raised before any row is processed.
 */
public class StructuralImportException extends RuntimeException {

    private final List<String> problems;

    public StructuralImportException(List<String> problems) {
        super("Spreadsheet rejected: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public StructuralImportException(String problem, Throwable cause) {
        super("Spreadsheet rejected: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}
