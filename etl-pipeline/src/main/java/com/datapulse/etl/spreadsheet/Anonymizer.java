package com.datapulse.etl.spreadsheet;

import com.datapulse.etl.model.RevenueBand;
import com.datapulse.etl.transform.ContentHasher;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Replaces personal data with a salted hash and exact revenue with a range.
 *
 * The hash is deterministic for a given salt and input, so the same contact gets the same
 * pseudonym across runs, and cannot be reversed without the salt.
 */
public class Anonymizer {

    private final String salt;

    public Anonymizer(String salt) {
        if (salt == null || salt.isBlank()) {
            throw new IllegalArgumentException("Anonymization salt must be configured");
        }
        this.salt = salt;
    }

    public Optional<String> pseudonymize(List<String> values) {
        return pseudonymize(values, salt);
    }

    /**
     * SHA-256 of {@code salt + ":" + non-empty trimmed values joined with "|"}, in lowercase
     * hex. Empty when every value is empty.
     */
    public static Optional<String> pseudonymize(List<String> values, String salt) {
        String joined = values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.joining("|"));
        if (joined.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ContentHasher.sha256Hex(salt + ":" + joined));
    }

    /** Range label for an annual revenue in euros; "Non renseigné" when missing. */
    public static String bucketRevenue(Double revenue) {
        if (revenue == null || revenue.isNaN()) {
            return RevenueBand.NOT_PROVIDED;
        }
        return RevenueBand.of(revenue).label();
    }
}
