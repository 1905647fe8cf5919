package com.datapulse.etl.geo;

import com.datapulse.etl.model.GeocodeLookup;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Memoizes geocoding answers under a normalized address key.
 *
 * A stored {@link GeocodeLookup.Status#NOT_FOUND} means "confirmed not found" and is served
 * like any other hit; an absent key means "not yet asked". Failed lookups are refused.
 * Owned by one {@link GeocodingClient}; not thread-safe.
 */
public class GeocodeCache {

    private final Map<String, GeocodeLookup> entries = new HashMap<>();

    /**
     * Lowercase-trimmed address, then lowercase-trimmed city and trimmed postcode when
     * present, joined with '|'.
     */
    public static String key(String address, String city, String postcode) {
        StringBuilder key = new StringBuilder(normalize(address));
        if (city != null && !city.isBlank()) {
            key.append('|').append(normalize(city));
        }
        if (postcode != null && !postcode.isBlank()) {
            key.append('|').append(postcode.trim());
        }
        return key.toString();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<GeocodeLookup> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(String key, GeocodeLookup lookup) {
        if (!lookup.isCacheable()) {
            throw new IllegalArgumentException("Failed lookups are not cached: " + key);
        }
        entries.put(key, lookup);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
