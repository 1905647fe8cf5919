package com.datapulse.etl.transform;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL-safe keys for dimension rows: lowercased, trimmed, inner whitespace as hyphens.
 */
public final class Slugs {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Slugs() {
    }

    /** "  Historical Fiction " → "historical-fiction" */
    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    }
}
