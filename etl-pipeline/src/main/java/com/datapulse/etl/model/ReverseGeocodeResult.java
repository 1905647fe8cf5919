package com.datapulse.etl.model;

/**
 * Address nearest to a coordinate pair.
 */
public record ReverseGeocodeResult(
        String label,
        String houseNumber,
        String street,
        String city,
        String postcode,
        String context) {
}
