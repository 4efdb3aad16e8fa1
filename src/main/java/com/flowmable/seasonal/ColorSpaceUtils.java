package com.flowmable.seasonal;

import java.util.Locale;

/**
 * Color space conversion utilities.
 * <p>
 * Provides hex → sRGB → CIE XYZ → CIELAB conversion (D65 illuminant). Malformed
 * hex input is reported as {@code null}, never as an exception.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // D65 white point, XYZ scaled 0–100
    private static final double XN = 95.047;
    private static final double YN = 100.000;
    private static final double ZN = 108.883;

    private static final double DELTA = 6.0 / 29.0;
    private static final double DELTA_CUBED = DELTA * DELTA * DELTA;

    /**
     * Parse {@code #RRGGBB} or {@code #RGB} (case-insensitive, {@code #} optional).
     *
     * @return the channels, or null if the string is not a valid hex color
     */
    public static Rgb hexToRgb(String hex) {
        if (hex == null) {
            return null;
        }
        String clean = hex.trim();
        if (clean.startsWith("#")) {
            clean = clean.substring(1);
        }
        if (clean.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (int i = 0; i < 3; i++) {
                expanded.append(clean.charAt(i)).append(clean.charAt(i));
            }
            clean = expanded.toString();
        }
        if (clean.length() != 6) {
            return null;
        }

        int r = parseChannel(clean, 0);
        int g = parseChannel(clean, 2);
        int b = parseChannel(clean, 4);
        if (r < 0 || g < 0 || b < 0) {
            return null;
        }
        return new Rgb(r, g, b);
    }

    /**
     * Convert sRGB (0–255 per channel) to CIE XYZ scaled 0–100.
     */
    public static Xyz rgbToXyz(Rgb rgb) {
        // 1. sRGB → linear RGB
        double rl = gammaExpand(rgb.r() / 255.0);
        double gl = gammaExpand(rgb.g() / 255.0);
        double bl = gammaExpand(rgb.b() / 255.0);

        // 2. Linear RGB → XYZ (D65 illuminant)
        double x = (0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl) * 100.0;
        double y = (0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl) * 100.0;
        double z = (0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl) * 100.0;
        return new Xyz(x, y, z);
    }

    /**
     * Convert CIE XYZ (0–100) to CIELAB relative to the D65 white point.
     */
    public static Lab xyzToLab(Xyz xyz) {
        double fx = labF(xyz.x() / XN);
        double fy = labF(xyz.y() / YN);
        double fz = labF(xyz.z() / ZN);

        double l = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double b = 200.0 * (fy - fz);
        return new Lab(l, a, b);
    }

    /**
     * Convert a hex color straight to CIELAB.
     *
     * @return the Lab point, or null if {@code hex} is malformed
     */
    public static Lab hexToLab(String hex) {
        Rgb rgb = hexToRgb(hex);
        if (rgb == null) {
            return null;
        }
        return xyzToLab(rgbToXyz(rgb));
    }

    /**
     * Format channels as an uppercase {@code #RRGGBB} string.
     */
    public static String rgbToHex(Rgb rgb) {
        return String.format(Locale.ROOT, "#%02X%02X%02X", rgb.r(), rgb.g(), rgb.b());
    }

    private static int parseChannel(String hex, int offset) {
        int hi = hexDigit(hex.charAt(offset));
        int lo = hexDigit(hex.charAt(offset + 1));
        if (hi < 0 || lo < 0) {
            return -1;
        }
        return hi * 16 + lo;
    }

    // ASCII only: Character.digit also accepts fullwidth and other Unicode digits
    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double labF(double t) {
        return t > DELTA_CUBED ? Math.cbrt(t) : t / (3.0 * DELTA * DELTA) + 4.0 / 29.0;
    }
}
