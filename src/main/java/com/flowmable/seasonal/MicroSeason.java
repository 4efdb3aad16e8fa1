package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The twelve micro-seasons, each belonging to exactly one {@link ParentSeason}.
 * <p>
 * Declaration order is the registry scan order and therefore the tie-break order
 * of the classifier. Do not reorder.
 */
public enum MicroSeason {
    LIGHT_SPRING("light_spring", ParentSeason.SPRING),
    WARM_SPRING("warm_spring", ParentSeason.SPRING),
    BRIGHT_SPRING("bright_spring", ParentSeason.SPRING),
    LIGHT_SUMMER("light_summer", ParentSeason.SUMMER),
    COOL_SUMMER("cool_summer", ParentSeason.SUMMER),
    SOFT_SUMMER("soft_summer", ParentSeason.SUMMER),
    SOFT_AUTUMN("soft_autumn", ParentSeason.AUTUMN),
    WARM_AUTUMN("warm_autumn", ParentSeason.AUTUMN),
    DEEP_AUTUMN("deep_autumn", ParentSeason.AUTUMN),
    BRIGHT_WINTER("bright_winter", ParentSeason.WINTER),
    COOL_WINTER("cool_winter", ParentSeason.WINTER),
    DEEP_WINTER("deep_winter", ParentSeason.WINTER);

    private final String tag;
    private final ParentSeason parent;

    MicroSeason(String tag, ParentSeason parent) {
        this.tag = tag;
        this.parent = parent;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public ParentSeason parent() {
        return parent;
    }

    @JsonCreator
    public static MicroSeason from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MicroSeason season : values()) {
            if (season.tag.equals(normalized)) {
                return season;
            }
        }
        throw new IllegalArgumentException("Unsupported micro-season: " + value);
    }
}
