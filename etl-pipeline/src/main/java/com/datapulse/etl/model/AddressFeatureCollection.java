package com.datapulse.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the GeoJSON returned by api-adresse.data.gouv.fr.
 * Kept separate from {@link GeocodeResult} to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AddressFeatureCollection {

    private List<Feature> features = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Feature {
        private Geometry geometry;
        private Properties properties;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Geometry {
        /** GeoJSON order: [longitude, latitude] */
        private List<Double> coordinates;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {
        private String label;
        private Double score;
        private String housenumber;
        private String street;
        private String city;
        private String postcode;
        private String context;
        private String type;
    }
}
