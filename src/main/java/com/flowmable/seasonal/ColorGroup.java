package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic color bucket within a micro-season palette.
 */
public enum ColorGroup {
    /** Base wardrobe colors. */
    NEUTRALS("neutrals"),
    /** Complementary but wearable colors. */
    ACCENTS("accents"),
    /** High-saturation statement colors. */
    BRIGHTS("brights"),
    /** Muted, desaturated variants. */
    SOFTS("softs");

    private final String tag;

    ColorGroup(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static ColorGroup from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ColorGroup group : values()) {
            if (group.tag.equals(normalized)) {
                return group;
            }
        }
        throw new IllegalArgumentException("Unsupported color group: " + value);
    }
}
