package com.datapulse.etl.transform;

import java.util.List;

/**
 * Silver records of one domain.
 *
 * @param duplicates bronze records dropped as content duplicates
 * @param failed     bronze records that could not be converted
 * @param errors     one message per failed record
 */
public record TransformResult<T>(List<T> records, int duplicates, int failed, List<String> errors) {
}
