package com.datapulse.etl.model;

import java.util.Optional;

/**
 * Outcome of one geocoding call.
 *
 * FOUND and NOT_FOUND are terminal answers from the API and are cached. FAILED means the
 * request itself did not succeed after its retries; it is never cached so a later call
 * asks again.
 */
public record GeocodeLookup(Status status, GeocodeResult result, String reason) {

    public enum Status { FOUND, NOT_FOUND, FAILED }

    public static GeocodeLookup found(GeocodeResult result) {
        return new GeocodeLookup(Status.FOUND, result, null);
    }

    public static GeocodeLookup notFound() {
        return new GeocodeLookup(Status.NOT_FOUND, null, null);
    }

    public static GeocodeLookup failed(String reason) {
        return new GeocodeLookup(Status.FAILED, null, reason);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isCacheable() {
        return status != Status.FAILED;
    }

    public Optional<GeocodeResult> asOptional() {
        return Optional.ofNullable(result);
    }
}
