package com.datapulse.etl.transform;

import java.util.List;

/**
 * Records kept after deduplication, in first-seen order.
 */
public record DedupResult<T>(List<T> retained, int duplicates) {
}
