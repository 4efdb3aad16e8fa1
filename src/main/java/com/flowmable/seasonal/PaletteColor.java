package com.flowmable.seasonal;

import java.util.Objects;

/**
 * A named reference color with its precomputed Lab value.
 *
 * @param name Display name, e.g. "True White"
 * @param hex  The literal hex from the palette data
 * @param lab  CIELAB value, computed once when the registry is built
 */
public record PaletteColor(String name, String hex, Lab lab) {

    public PaletteColor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(hex, "hex");
        Objects.requireNonNull(lab, "lab");
    }
}
