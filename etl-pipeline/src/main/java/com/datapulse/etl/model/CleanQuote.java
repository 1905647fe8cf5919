package com.datapulse.etl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Silver quote, unique within its batch by {@link #textHash}.
 */
@Value
@Builder
public class CleanQuote {

    String text;

    /** SHA-256 of the lowercased, trimmed text */
    String textHash;

    String author;
    String authorSlug;
    String authorUrl;

    /** Tag slugs, in page order, without duplicates */
    @Singular
    List<String> tags;

    /** Display name of each tag slug, as first seen on the page */
    @Singular
    Map<String, String> tagNames;

    int textLength;

    LocalDateTime scrapedAt;
    String batchId;
}
