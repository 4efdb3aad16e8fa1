package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four coarse seasonal families.
 */
public enum ParentSeason {
    SPRING("spring", Undertone.WARM),
    SUMMER("summer", Undertone.COOL),
    AUTUMN("autumn", Undertone.WARM),
    WINTER("winter", Undertone.COOL);

    private final String tag;
    private final Undertone expectedUndertone;

    ParentSeason(String tag, Undertone expectedUndertone) {
        this.tag = tag;
        this.expectedUndertone = expectedUndertone;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Warm for spring and autumn, cool for summer and winter. */
    public Undertone expectedUndertone() {
        return expectedUndertone;
    }

    @JsonCreator
    public static ParentSeason from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ParentSeason season : values()) {
            if (season.tag.equals(normalized)) {
                return season;
            }
        }
        throw new IllegalArgumentException("Unsupported season: " + value);
    }
}
