package com.datapulse.etl.geo;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.extract.FetchOutcome;
import com.datapulse.etl.extract.ResilientFetcher;
import com.datapulse.etl.model.AddressFeatureCollection;
import com.datapulse.etl.model.GeocodeLookup;
import com.datapulse.etl.model.GeocodeResult;
import com.datapulse.etl.model.ReverseGeocodeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Resolves French addresses to coordinates with the free api-adresse.data.gouv.fr API.
 * No API key required.
 *
 * Example: "10 Rue de Rivoli", "Paris", "75001" → {lat: 48.8556, lon: 2.3589}
 *
 * Every request goes through this client's own throttle, so calls to the API are
 * serialized behind one rate limit. Answers, including "not found", are cached until
 * {@link #clearCache()}, which the orchestrator calls at the start of every run.
 */
@Slf4j
public class GeocodingClient {

    private final ResilientFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int limit;
    private final GeocodeCache cache = new GeocodeCache();
    private final GeocodingStats stats = new GeocodingStats();

    public GeocodingClient(ResilientFetcher fetcher, ObjectMapper objectMapper, String baseUrl, int limit) {
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.limit = Math.max(1, limit);
    }

    public GeocodeLookup geocode(String address, String city, String postcode, CancellationToken token) {
        if (StringUtils.isBlank(address)) {
            return GeocodeLookup.notFound();
        }
        String key = GeocodeCache.key(address, city, postcode);
        Optional<GeocodeLookup> cached = cache.get(key);
        if (cached.isPresent()) {
            stats.setCacheHits(stats.getCacheHits() + 1);
            log.debug("Geocode cache hit for '{}'", key);
            return cached.get();
        }

        GeocodeLookup lookup = search(address, city, postcode, token);
        if (lookup.isCacheable()) {
            cache.put(key, lookup);
        }
        return lookup;
    }

    /**
     * Geocodes each query in order. The result list has the same size and order as the
     * input; unresolved entries carry a not-found or failed lookup.
     */
    public List<GeocodeLookup> geocodeBatch(List<AddressQuery> queries, CancellationToken token) {
        List<GeocodeLookup> results = new ArrayList<>(queries.size());
        int found = 0;
        for (AddressQuery query : queries) {
            token.throwIfCancelled();
            GeocodeLookup lookup = geocode(query.address(), query.city(), query.postcode(), token);
            if (lookup.isFound()) {
                found++;
            }
            results.add(lookup);
        }
        log.info("Geocoded {}/{} addresses ({} cache hits so far)", found, queries.size(), stats.getCacheHits());
        return results;
    }

    /** Nearest address to a point, empty when the API has none or the request fails. */
    public Optional<ReverseGeocodeResult> reverseGeocode(double latitude, double longitude, CancellationToken token) {
        String url = baseUrl + "/reverse/?lon=" + format(longitude) + "&lat=" + format(latitude);
        FetchOutcome outcome = request(url, token);
        if (!outcome.isOk()) {
            return Optional.empty();
        }
        AddressFeatureCollection collection;
        try {
            collection = parse(outcome);
        } catch (IOException e) {
            stats.setErrors(stats.getErrors() + 1);
            log.warn("Unreadable reverse geocoding response from {}: {}", url, e.getMessage());
            return Optional.empty();
        }
        return firstFeature(collection).map(feature -> {
            AddressFeatureCollection.Properties p = feature.getProperties();
            return new ReverseGeocodeResult(p.getLabel(), p.getHousenumber(), p.getStreet(),
                    p.getCity(), p.getPostcode(), p.getContext());
        });
    }

    public GeocodingStats getStats() {
        GeocodingStats snapshot = new GeocodingStats();
        snapshot.setRequests(stats.getRequests());
        snapshot.setCacheHits(stats.getCacheHits());
        snapshot.setFound(stats.getFound());
        snapshot.setNotFound(stats.getNotFound());
        snapshot.setErrors(stats.getErrors());
        snapshot.setCacheSize(cache.size());
        return snapshot;
    }

    public void clearCache() {
        cache.clear();
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    private GeocodeLookup search(String address, String city, String postcode, CancellationToken token) {
        String url = searchUrl(address, city, postcode);
        FetchOutcome outcome = request(url, token);

        if (outcome.kind() == FetchOutcome.Kind.NOT_FOUND) {
            stats.setNotFound(stats.getNotFound() + 1);
            return GeocodeLookup.notFound();
        }
        if (!outcome.isOk()) {
            stats.setErrors(stats.getErrors() + 1);
            log.warn("Geocoding failed for '{}': {}", address, outcome.reason());
            return GeocodeLookup.failed(outcome.reason());
        }

        AddressFeatureCollection collection;
        try {
            collection = parse(outcome);
        } catch (IOException e) {
            stats.setErrors(stats.getErrors() + 1);
            log.warn("Unreadable geocoding response for '{}': {}", address, e.getMessage());
            return GeocodeLookup.failed("Unreadable response: " + e.getMessage());
        }

        Optional<GeocodeResult> result = firstFeature(collection).flatMap(GeocodingClient::toResult);
        if (result.isEmpty()) {
            stats.setNotFound(stats.getNotFound() + 1);
            log.debug("No match for '{}'", address);
            return GeocodeLookup.notFound();
        }
        stats.setFound(stats.getFound() + 1);
        log.debug("Geocoded '{}' → lat={}, lon={}", address, result.get().latitude(), result.get().longitude());
        return GeocodeLookup.found(result.get());
    }

    String searchUrl(String address, String city, String postcode) {
        StringJoiner q = new StringJoiner(" ");
        q.add(address.trim());
        if (StringUtils.isNotBlank(city)) {
            q.add(city.trim());
        }
        if (StringUtils.isNotBlank(postcode)) {
            q.add(postcode.trim());
        }
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/search/?q=").append(URLEncoder.encode(q.toString(), StandardCharsets.UTF_8))
                .append("&limit=").append(limit);
        if (StringUtils.isNotBlank(postcode)) {
            url.append("&postcode=").append(URLEncoder.encode(postcode.trim(), StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    private FetchOutcome request(String url, CancellationToken token) {
        stats.setRequests(stats.getRequests() + 1);
        return fetcher.fetch(url, token);
    }

    /** A body that is not a FeatureCollection is an error, never an empty answer. */
    private AddressFeatureCollection parse(FetchOutcome outcome) throws IOException {
        if (outcome.body() == null) {
            throw new IOException("empty body");
        }
        AddressFeatureCollection collection = objectMapper.readValue(outcome.body(), AddressFeatureCollection.class);
        if (collection == null) {
            throw new IOException("null document");
        }
        return collection;
    }

    private static Optional<AddressFeatureCollection.Feature> firstFeature(AddressFeatureCollection collection) {
        if (collection.getFeatures() == null || collection.getFeatures().isEmpty()) {
            return Optional.empty();
        }
        AddressFeatureCollection.Feature first = collection.getFeatures().get(0);
        return first.getProperties() == null ? Optional.empty() : Optional.of(first);
    }

    /** GeoJSON coordinates are [lon, lat]. */
    private static Optional<GeocodeResult> toResult(AddressFeatureCollection.Feature feature) {
        if (feature.getGeometry() == null || feature.getGeometry().getCoordinates() == null
                || feature.getGeometry().getCoordinates().size() < 2) {
            return Optional.empty();
        }
        List<Double> coordinates = feature.getGeometry().getCoordinates();
        AddressFeatureCollection.Properties p = feature.getProperties();
        return Optional.of(new GeocodeResult(
                coordinates.get(1),
                coordinates.get(0),
                p.getLabel(),
                p.getScore() == null ? 0.0 : p.getScore(),
                p.getCity(),
                p.getPostcode(),
                p.getContext(),
                p.getType(),
                LocalDateTime.now()));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
