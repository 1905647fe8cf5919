package com.datapulse.etl.spreadsheet;

import java.util.List;

/**
 * Column names of the partner bookshop spreadsheet.
 */
public final class LibrairieColumns {

    public static final String NAME = "nom_librairie";
    public static final String ADDRESS = "adresse";
    public static final String POSTCODE = "code_postal";
    public static final String CITY = "ville";
    public static final String CONTACT_NAME = "contact_nom";
    public static final String CONTACT_EMAIL = "contact_email";
    public static final String CONTACT_PHONE = "contact_telephone";
    public static final String ANNUAL_REVENUE = "ca_annuel";
    public static final String PARTNERSHIP_DATE = "date_partenariat";
    public static final String SPECIALTY = "specialite";

    public static final List<String> EXPECTED = List.of(
            NAME, ADDRESS, POSTCODE, CITY,
            CONTACT_NAME, CONTACT_EMAIL, CONTACT_PHONE,
            ANNUAL_REVENUE, PARTNERSHIP_DATE, SPECIALTY);

    /** Columns holding personal data, hashed together into the contact hash. */
    public static final List<String> PERSONAL = List.of(CONTACT_NAME, CONTACT_EMAIL, CONTACT_PHONE);

    private LibrairieColumns() {
    }
}
