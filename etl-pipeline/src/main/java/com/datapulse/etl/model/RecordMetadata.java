package com.datapulse.etl.model;

import java.time.LocalDateTime;

/**
 * Lineage attached to every bronze record.
 *
 * @param source    site or file the record came from
 * @param fetchedAt when the record was scraped or imported
 * @param batchId   the pipeline run that produced it
 */
public record RecordMetadata(String source, LocalDateTime fetchedAt, String batchId) {

    public static RecordMetadata now(String source, String batchId) {
        return new RecordMetadata(source, LocalDateTime.now(), batchId);
    }
}
