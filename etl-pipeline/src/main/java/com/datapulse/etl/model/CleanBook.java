package com.datapulse.etl.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Silver book: prices converted, rating and stock parsed, keys computed.
 */
@Value
@Builder
public class CleanBook {

    /** Content key of the fact row (hash of the normalized product URL) */
    String bookKey;

    String title;
    String category;
    String categorySlug;

    BigDecimal priceGbp;
    BigDecimal priceEur;

    /** 1..5, or 0 when the rating token was not recognised */
    int rating;

    boolean inStock;
    int stockCount;

    String url;
    String imageUrl;

    LocalDateTime scrapedAt;
    String batchId;
}
