package com.datapulse.etl.service;

import com.datapulse.etl.model.Domain;
import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-run overrides. Null values fall back to the configured defaults.
 */
@Value
@Builder
public class RunOptions {

    @Builder.Default
    Set<Domain> domains = EnumSet.allOf(Domain.class);

    Integer maxQuotePages;
    Integer limitCategories;
    Integer maxCategoryPages;
    Boolean downloadImages;
    String spreadsheetPath;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }

    /** Small run for smoke testing: 2 categories of 1 page, 2 quote pages, no images. */
    public static RunOptions testMode(Set<Domain> domains) {
        return RunOptions.builder()
                .domains(domains)
                .limitCategories(2)
                .maxCategoryPages(1)
                .maxQuotePages(2)
                .downloadImages(false)
                .build();
    }
}
