package com.datapulse.etl.geo;

import lombok.Data;

/**
 * Running counters of a {@link GeocodingClient}.
 */
@Data
public class GeocodingStats {

    private int requests;
    private int cacheHits;
    private int found;
    private int notFound;
    private int errors;
    private int cacheSize;
}
