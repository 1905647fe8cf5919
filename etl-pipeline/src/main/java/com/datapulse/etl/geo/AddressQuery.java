package com.datapulse.etl.geo;

/**
 * One address to geocode; city and postcode may be null.
 */
public record AddressQuery(String address, String city, String postcode) {
}
