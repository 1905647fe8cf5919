package com.datapulse.etl.model;

import lombok.Data;

/**
 * Per-domain counts accumulated over one run.
 */
@Data
public class DomainCounters {

    private int extracted;
    private int transformed;
    private int loaded;
    private int duplicates;
    private int invalid;
    private int failed;

    public void addDuplicates(int n) { duplicates += n; }
    public void addInvalid(int n)    { invalid += n; }
    public void addFailed(int n)     { failed += n; }
    public void addLoaded(int n)     { loaded += n; }
}
