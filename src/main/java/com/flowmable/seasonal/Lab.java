package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * CIELAB color, the representation used for every distance comparison.
 *
 * @param l Lightness L* [0, 100]
 * @param a Green–red axis a*
 * @param b Blue–yellow axis b*
 */
public record Lab(@JsonProperty("L") double l, double a, double b) {

    /** Chroma C* = sqrt(a² + b²). */
    public double chroma() {
        return Math.sqrt(a * a + b * b);
    }

    /** Hue angle in degrees, [0, 360). */
    public double hueDegrees() {
        double h = Math.toDegrees(Math.atan2(b, a));
        return h < 0 ? h + 360.0 : h;
    }
}
