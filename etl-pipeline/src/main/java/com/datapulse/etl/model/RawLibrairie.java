package com.datapulse.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Bronze partner bookshop row from the spreadsheet.
 *
 * Carries the contact's personal data in clear text. It is only ever exported to the
 * bronze layer of the object store, never to silver or gold.
 */
@Value
@Builder
public class RawLibrairie {

    /** 1-based spreadsheet row number, header being row 1 */
    int rowNumber;

    String name;
    String address;
    String postcode;
    String city;

    // ── Personal data ───────────────────────────────────────────────────────
    String contactName;
    String contactEmail;
    String contactPhone;

    // ── Confidential ────────────────────────────────────────────────────────
    /** Annual revenue in euros, null when the cell is empty */
    Double annualRevenue;

    LocalDate partnershipDate;
    String specialty;

    RecordMetadata metadata;
}
