package com.datapulse.etl.model;

/**
 * The three ingestion domains, processed in declaration order.
 */
public enum Domain {

    BOOKS("books", "books.toscrape.com"),
    QUOTES("quotes", "quotes.toscrape.com"),
    LIBRAIRIES("librairies", "partenaire_librairies.xlsx");

    private final String key;
    private final String source;

    Domain(String key, String source) {
        this.key = key;
        this.source = source;
    }

    /** Lowercase name used in object names and report keys. */
    public String key() {
        return key;
    }

    /** Default value of {@link RecordMetadata#source()} for records of this domain. */
    public String source() {
        return source;
    }
}
