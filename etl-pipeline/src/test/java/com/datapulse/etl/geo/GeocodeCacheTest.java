package com.datapulse.etl.geo;

import com.datapulse.etl.model.GeocodeLookup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeocodeCacheTest {

    @Test
    void keyIgnoresCaseAndSurroundingSpaces() {
        assertThat(GeocodeCache.key("  10 Rue de Rivoli ", "PARIS", " 75001 "))
                .isEqualTo(GeocodeCache.key("10 rue de rivoli", "paris", "75001"))
                .isEqualTo("10 rue de rivoli|paris|75001");
    }

    @Test
    void blankPartsAreLeftOut() {
        assertThat(GeocodeCache.key("10 rue de Rivoli", " ", null)).isEqualTo("10 rue de rivoli");
        assertThat(GeocodeCache.key("10 rue de Rivoli", null, "75001")).isEqualTo("10 rue de rivoli|75001");
    }

    @Test
    void confirmedNotFoundIsAHit() {
        GeocodeCache cache = new GeocodeCache();
        cache.put("nowhere", GeocodeLookup.notFound());

        assertThat(cache.get("nowhere")).contains(GeocodeLookup.notFound());
        assertThat(cache.get("elsewhere")).isEmpty();
    }

    @Test
    void failedLookupsAreRefused() {
        GeocodeCache cache = new GeocodeCache();

        assertThatThrownBy(() -> cache.put("k", GeocodeLookup.failed("HTTP 503")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cache.size()).isZero();
    }
}
