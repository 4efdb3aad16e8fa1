package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intensity band of a garment's chroma, used to cap ratings for muted users.
 */
public enum ChromaLevel {
    SOFT("soft"),
    MILD("mild"),
    VIVID("vivid"),
    VERY_VIVID("very_vivid"),
    NEON("neon");

    private final String tag;

    ChromaLevel(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public static ChromaLevel of(double chroma) {
        if (chroma >= 70) return NEON;
        if (chroma >= 55) return VERY_VIVID;
        if (chroma >= 45) return VIVID;
        if (chroma >= 30) return MILD;
        return SOFT;
    }

    public boolean isVividOrAbove() {
        return compareTo(VIVID) >= 0;
    }
}
