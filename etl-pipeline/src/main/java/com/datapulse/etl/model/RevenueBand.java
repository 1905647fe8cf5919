package com.datapulse.etl.model;

/**
 * Annual revenue ranges published in place of the exact figure.
 */
public enum RevenueBand {

    UNDER_100K("< 100k€", 100_000),
    FROM_100K_TO_250K("100k€ - 250k€", 250_000),
    FROM_250K_TO_500K("250k€ - 500k€", 500_000),
    FROM_500K_TO_1M("500k€ - 1M€", 1_000_000),
    OVER_1M("> 1M€", Double.POSITIVE_INFINITY);

    public static final String NOT_PROVIDED = "Non renseigné";

    private final String label;
    private final double upperBoundExclusive;

    RevenueBand(String label, double upperBoundExclusive) {
        this.label = label;
        this.upperBoundExclusive = upperBoundExclusive;
    }

    public String label() {
        return label;
    }

    public static RevenueBand of(double revenue) {
        for (RevenueBand band : values()) {
            if (revenue < band.upperBoundExclusive) {
                return band;
            }
        }
        return OVER_1M;
    }
}
