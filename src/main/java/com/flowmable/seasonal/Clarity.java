package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Saturation level of a complexion or a garment.
 * <p>
 * {@link #VIVID} only appears in user profiles; every decision treats it as {@link #CLEAR}.
 */
public enum Clarity {
    MUTED("muted"),
    MEDIUM("medium"),
    CLEAR("clear"),
    VIVID("vivid");

    private final String tag;

    Clarity(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Folds {@link #VIVID} into {@link #CLEAR}. Null stays null. */
    public static Clarity normalize(Clarity clarity) {
        return clarity == VIVID ? CLEAR : clarity;
    }

    @JsonCreator
    public static Clarity from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Clarity clarity : values()) {
            if (clarity.tag.equals(normalized)) {
                return clarity;
            }
        }
        throw new IllegalArgumentException("Unsupported clarity: " + value);
    }
}
