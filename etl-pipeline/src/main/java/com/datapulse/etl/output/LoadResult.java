package com.datapulse.etl.output;

import java.util.List;

/**
 * Outcome of loading one domain into the gold layer.
 *
 * @param inserted new fact or dimension rows
 * @param existing rows skipped because their key was already loaded, in this run or before
 * @param failed   records lost to a record-level persistence error
 */
public record LoadResult(int inserted, int existing, int failed, List<String> errors) {
}
