package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How well a garment color suits a particular user.
 */
public enum ColorRating {
    GREAT("great"),
    GOOD("good"),
    OK("ok"),
    RISKY("risky"),
    /** No valid color or no season to compare against. */
    INSUFFICIENT_DATA("insufficient_data");

    private final String tag;

    ColorRating(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Great or good: eligible for suggested products. */
    public boolean isRecommended() {
        return this == GREAT || this == GOOD;
    }
}
