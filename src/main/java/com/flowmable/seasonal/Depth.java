package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lightness level of a complexion or a garment.
 */
public enum Depth {
    LIGHT("light", 0),
    MEDIUM("medium", 1),
    DEEP("deep", 2);

    private final String tag;
    private final int level;

    Depth(String tag, int level) {
        this.tag = tag;
        this.level = level;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Number of steps between two depths: 0 equal, 1 adjacent, 2 opposite. */
    public int distanceTo(Depth other) {
        return Math.abs(level - other.level);
    }

    @JsonCreator
    public static Depth from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Depth depth : values()) {
            if (depth.tag.equals(normalized)) {
                return depth;
            }
        }
        throw new IllegalArgumentException("Unsupported depth: " + value);
    }
}
