package com.flowmable.seasonal;

/**
 * One {@code (microSeason, group, color)} triple of the registry enumeration.
 */
public record PaletteEntry(MicroSeason microSeason, ColorGroup group, PaletteColor color) {

    /** True if both entries belong to the same micro-season and the same group. */
    public boolean sharesGroupWith(PaletteEntry other) {
        return microSeason == other.microSeason && group == other.group;
    }
}
