package com.datapulse.etl.transform;

import com.datapulse.etl.model.CleanLibrairie;
import com.datapulse.etl.model.GeocodeLookup;
import com.datapulse.etl.model.GeocodeResult;
import com.datapulse.etl.model.RawLibrairie;
import com.datapulse.etl.spreadsheet.Anonymizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Bronze to silver for partner bookshops. Contact fields are replaced by their hash and
 * the revenue by its range; no personal value is carried over.
 */
@Slf4j
public class LibrairieTransformer {

    private final Anonymizer anonymizer;

    public LibrairieTransformer(Anonymizer anonymizer) {
        this.anonymizer = anonymizer;
    }

    /**
     * @param geocodes one lookup per bronze record, same order; may be empty when geocoding
     *                 was skipped
     */
    public TransformResult<CleanLibrairie> transform(List<RawLibrairie> rawLibrairies, List<GeocodeLookup> geocodes) {
        if (!geocodes.isEmpty() && geocodes.size() != rawLibrairies.size()) {
            throw new IllegalArgumentException("Expected " + rawLibrairies.size() + " geocodes, got " + geocodes.size());
        }
        LocalDateTime now = LocalDateTime.now();
        List<CleanLibrairie> converted = new ArrayList<>(rawLibrairies.size());
        for (int i = 0; i < rawLibrairies.size(); i++) {
            GeocodeLookup lookup = geocodes.isEmpty() ? GeocodeLookup.notFound() : geocodes.get(i);
            converted.add(toClean(rawLibrairies.get(i), lookup, now));
        }
        DedupResult<CleanLibrairie> deduplicated =
                ContentDeduplicator.deduplicate(converted, CleanLibrairie::getLibrairieKey);
        log.info("Librairies: {} → {} clean ({} duplicates)",
                rawLibrairies.size(), deduplicated.retained().size(), deduplicated.duplicates());
        return new TransformResult<>(deduplicated.retained(), deduplicated.duplicates(), 0, List.of());
    }

    private CleanLibrairie toClean(RawLibrairie raw, GeocodeLookup lookup, LocalDateTime now) {
        String name = StringUtils.normalizeSpace(raw.getName());
        String postcode = raw.getPostcode().trim();
        GeocodeResult geo = lookup.isFound() ? lookup.result() : null;

        return CleanLibrairie.builder()
                .librairieKey(naturalKey(name, postcode))
                .name(name)
                .address(StringUtils.normalizeSpace(raw.getAddress()))
                .postcode(postcode)
                .city(titleCase(raw.getCity()))
                .specialty(StringUtils.normalizeSpace(raw.getSpecialty()))
                .partnershipDate(raw.getPartnershipDate())
                .revenueRange(Anonymizer.bucketRevenue(raw.getAnnualRevenue()))
                .contactHash(anonymizer.pseudonymize(Arrays.asList(
                        raw.getContactName(), raw.getContactEmail(), raw.getContactPhone())).orElse(null))
                .latitude(geo == null ? null : geo.latitude())
                .longitude(geo == null ? null : geo.longitude())
                .geocodeScore(geo == null ? null : geo.score())
                .geocodeLabel(geo == null ? null : geo.label())
                .importedAt(now)
                .batchId(raw.getMetadata().batchId())
                .build();
    }

    /** slug(name) + "-" + postcode, e.g. "le-divan-75015" */
    public static String naturalKey(String name, String postcode) {
        return Slugs.slugify(name) + "-" + postcode.trim();
    }

    /** "saint-étienne" → "Saint-Étienne", "PARIS" → "Paris" */
    public static String titleCase(String city) {
        if (StringUtils.isBlank(city)) {
            return city;
        }
        String lower = StringUtils.normalizeSpace(city).toLowerCase(Locale.FRENCH);
        StringBuilder result = new StringBuilder(lower.length());
        boolean startOfWord = true;
        for (char c : lower.toCharArray()) {
            result.append(startOfWord ? Character.toTitleCase(c) : c);
            startOfWord = c == ' ' || c == '-' || c == '\'';
        }
        return result.toString();
    }
}
