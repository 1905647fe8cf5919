package com.datapulse.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Silver partner bookshop. Personal data is reduced to {@link #contactHash} and the
 * revenue to a range label.
 */
@Value
@Builder
public class CleanLibrairie {

    /** Natural key: slug of the name followed by the postcode */
    String librairieKey;

    String name;
    String address;
    String postcode;
    String city;
    String specialty;
    LocalDate partnershipDate;

    /** e.g. "250k€ - 500k€" */
    String revenueRange;

    /** Salted SHA-256 of the contact fields, null when the row had no contact */
    String contactHash;

    // ── Geocoding ───────────────────────────────────────────────────────────
    Double latitude;
    Double longitude;
    Double geocodeScore;
    String geocodeLabel;

    LocalDateTime importedAt;
    String batchId;
}
