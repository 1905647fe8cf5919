package com.datapulse.etl.output;

import java.time.Instant;
import java.util.List;

/**
 * Object count and total size of one bucket.
 *
 * @param lastModified most recent modification, null for an empty bucket
 */
public record BucketStats(String bucket, int objects, long totalBytes, Instant lastModified) {

    public static BucketStats of(String bucket, List<StoredObject> listing) {
        long bytes = 0;
        Instant latest = null;
        for (StoredObject object : listing) {
            bytes += object.size();
            if (object.lastModified() != null && (latest == null || object.lastModified().isAfter(latest))) {
                latest = object.lastModified();
            }
        }
        return new BucketStats(bucket, listing.size(), bytes, latest);
    }
}
