package com.datapulse.etl.model;

import java.time.LocalDateTime;

/**
 * First feature returned by the address search API, with coordinates already in
 * (latitude, longitude) order.
 */
public record GeocodeResult(
        double latitude,
        double longitude,
        String label,
        double score,
        String city,
        String postcode,
        String context,
        String type,
        LocalDateTime queriedAt) {
}
