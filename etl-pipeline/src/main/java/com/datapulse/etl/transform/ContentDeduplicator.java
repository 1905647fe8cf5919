package com.datapulse.etl.transform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Keeps the first record of each content key. Later ones are dropped and counted;
 * a duplicate is never an error.
 */
public final class ContentDeduplicator {

    private ContentDeduplicator() {
    }

    public static <T> DedupResult<T> deduplicate(List<T> records, Function<T, String> contentKey) {
        Set<String> seen = new HashSet<>();
        List<T> retained = new ArrayList<>(records.size());
        int duplicates = 0;
        for (T record : records) {
            if (seen.add(contentKey.apply(record))) {
                retained.add(record);
            } else {
                duplicates++;
            }
        }
        return new DedupResult<>(retained, duplicates);
    }
}
