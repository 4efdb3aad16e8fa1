package com.flowmable.seasonal;

/**
 * Name and hex of the palette color closest to a classified input.
 */
public record NearestColor(String name, String hex) {

    static NearestColor of(PaletteColor color) {
        return new NearestColor(color.name(), color.hex());
    }
}
