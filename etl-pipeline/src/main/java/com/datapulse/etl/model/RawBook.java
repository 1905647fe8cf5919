package com.datapulse.etl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Bronze book, exactly as read from a catalogue listing page.
 * All fields are raw text; nothing is converted yet.
 */
@Value
@Builder
public class RawBook {

    String title;

    /** Price with its currency symbol, e.g. "£51.77" */
    String priceText;

    /** Second CSS class of p.star-rating, e.g. "Three" */
    String ratingToken;

    /** e.g. "In stock (22 available)" */
    String availabilityText;

    /** Absolute URL of the cover thumbnail */
    String imageUrl;

    /** Absolute URL of the product page */
    String detailUrl;

    /** Category name as shown in the side menu */
    String category;

    RecordMetadata metadata;
}
