package com.flowmable.seasonal;

/**
 * Perceptual attributes of a garment color, read off its Lab value.
 *
 * @param undertone Warm, cool, neutral (achromatic) or olive (yellow with a slight green cast)
 * @param depth     Light if L* > 70, medium if L* > 45, otherwise deep
 * @param clarity   Muted if C* < 20, medium up to 30, otherwise clear
 * @param chroma    C* = sqrt(a² + b²)
 * @param hueAngle  Hue angle in degrees [0, 360)
 */
public record GarmentAttributes(
        Undertone undertone,
        Depth depth,
        Clarity clarity,
        double chroma,
        double hueAngle
) {
    private static final double NEUTRAL_CHROMA_BELOW = 10.0;

    public static GarmentAttributes of(Lab lab) {
        double chroma = lab.chroma();
        double hue = lab.hueDegrees();
        return new GarmentAttributes(
                undertoneOf(lab, chroma, hue),
                depthOf(lab),
                clarityOf(chroma),
                chroma,
                hue
        );
    }

    private static Undertone undertoneOf(Lab lab, double chroma, double hue) {
        if (chroma < NEUTRAL_CHROMA_BELOW) {
            return Undertone.NEUTRAL;
        }
        // Olive, khaki, sage: yellow-dominant with a small negative a*
        if (lab.b() > 8 && lab.a() < 0 && Math.abs(lab.a()) <= 12) {
            return Undertone.OLIVE;
        }
        if (hue >= 90 && hue <= 140 && lab.b() > 0) {
            return Undertone.OLIVE;
        }
        // Red, orange, yellow families
        if (hue <= 110 || hue >= 320) {
            return Undertone.WARM;
        }
        return Undertone.COOL;
    }

    private static Depth depthOf(Lab lab) {
        if (lab.l() > 70) return Depth.LIGHT;
        if (lab.l() > 45) return Depth.MEDIUM;
        return Depth.DEEP;
    }

    private static Clarity clarityOf(double chroma) {
        if (chroma < 20) return Clarity.MUTED;
        if (chroma <= 30) return Clarity.MEDIUM;
        return Clarity.CLEAR;
    }
}
