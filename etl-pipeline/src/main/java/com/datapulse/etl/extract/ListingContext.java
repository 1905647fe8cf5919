package com.datapulse.etl.extract;

/**
 * What an item parser knows about the listing it is reading.
 *
 * @param label   category name for books, tag or "all" for quotes
 * @param source  value written to the record metadata
 * @param batchId current run
 * @param pageUrl URL of the page being parsed
 */
public record ListingContext(String label, String source, String batchId, String pageUrl) {

    ListingContext onPage(String url) {
        return new ListingContext(label, source, batchId, url);
    }
}
