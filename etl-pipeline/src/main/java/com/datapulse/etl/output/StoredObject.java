package com.datapulse.etl.output;

import java.time.Instant;

/**
 * One entry of a bucket listing.
 */
public record StoredObject(String name, long size, Instant lastModified) {
}
