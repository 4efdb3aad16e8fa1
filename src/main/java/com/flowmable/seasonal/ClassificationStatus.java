package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence tier of a garment classification, derived from the ΔE gap between
 * the best match and the runner-up.
 */
public enum ClassificationStatus {
    /** Gap >= 4. The nearest palette is clearly the right one. */
    GREAT("great"),
    /** Gap in [2, 4). */
    GOOD("good"),
    /** Gap < 2. A different palette group is almost as close. */
    AMBIGUOUS("ambiguous"),
    /** Malformed color, empty registry, or nearest ΔE > 12. */
    UNCLASSIFIED("unclassified");

    private final String tag;

    ClassificationStatus(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** True for a confident match (great or good). */
    public boolean isConfident() {
        return this == GREAT || this == GOOD;
    }
}
