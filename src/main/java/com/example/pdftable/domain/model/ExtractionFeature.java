package com.example.pdftable.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Domain enumeration describing which outputs the caller wants.
 * Lets the application layer skip work nobody asked for.
 */
public enum ExtractionFeature {
    TABLE_ROWS,
    SERIALIZED_TABLE,
    PAGE_TEXT;

	/**
	 * Builds an {@link EnumSet} containing every feature value.
	 *
	 * @return enum set with all defined features
	 */
    public static EnumSet<ExtractionFeature> allFeatures() {
        return EnumSet.allOf(ExtractionFeature.class);
    }

	/**
	 * Converts a list of request parameters into an {@link EnumSet} of features.
	 * Invalid or unknown values are ignored and fall back to all features.
	 *
	 * @param rawValues feature names supplied by the caller
	 * @return parsed feature set or {@link #allFeatures()} when empty/invalid
	 */
    public static EnumSet<ExtractionFeature> fromStrings(List<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return allFeatures();
        }
        EnumSet<ExtractionFeature> features = EnumSet.noneOf(ExtractionFeature.class);
        for (String value : rawValues) {
            ExtractionFeature feature = fromString(value);
            if (feature != null) {
                features.add(feature);
            }
        }
        if (features.isEmpty()) {
            return allFeatures();
        }
        return features;
    }

    private static ExtractionFeature fromString(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return ExtractionFeature.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
