package com.datapulse.etl.extract;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters of one paginated listing. Page errors end the listing; item errors only skip
 * the element.
 */
@Data
public class ExtractionStats {

    private int pagesFetched;
    private int itemsParsed;
    private int itemErrors;
    private int pageErrors;
    private final List<String> errors = new ArrayList<>();

    void pageError(String message) {
        pageErrors++;
        errors.add(message);
    }

    void itemError(String message) {
        itemErrors++;
        errors.add(message);
    }

    public void add(ExtractionStats other) {
        pagesFetched += other.pagesFetched;
        itemsParsed += other.itemsParsed;
        itemErrors += other.itemErrors;
        pageErrors += other.pageErrors;
        errors.addAll(other.errors);
    }
}
