package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Color temperature family. {@link #OLIVE} is only ever computed for garments.
 */
public enum Undertone {
    WARM("warm"),
    COOL("cool"),
    NEUTRAL("neutral"),
    OLIVE("olive");

    private final String tag;

    Undertone(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static Undertone from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Undertone undertone : values()) {
            if (undertone.tag.equals(normalized)) {
                return undertone;
            }
        }
        throw new IllegalArgumentException("Unsupported undertone: " + value);
    }
}
