package com.flowmable.seasonal;

/**
 * ΔE thresholds of the personalized rating in {@link PersonalColorScorer}.
 * <p>
 * Deep garments (L* below {@code deepLightnessBelow}) get relaxed thresholds, since
 * CIEDE2000 spreads dark colors further apart than they read on the body.
 *
 * @param greatMax           ΔE at or below: GREAT
 * @param goodMax            ΔE at or below: GOOD
 * @param okMax              ΔE at or below: OK; above: RISKY
 * @param deepGreatMax       GREAT threshold for deep garments
 * @param deepGoodMax        GOOD threshold for deep garments
 * @param deepOkMax          OK threshold for deep garments
 * @param deepLightnessBelow L* below which a garment counts as deep
 * @param paletteMatchMax    ΔE at or below which an allowed-undertone garment is at least GOOD
 */
public record ScoringThresholds(
        double greatMax,
        double goodMax,
        double okMax,
        double deepGreatMax,
        double deepGoodMax,
        double deepOkMax,
        double deepLightnessBelow,
        double paletteMatchMax
) {
    public static final ScoringThresholds DEFAULT = new ScoringThresholds(
            6.0,  // greatMax
            12.0, // goodMax
            22.0, // okMax
            8.0,  // deepGreatMax
            16.0, // deepGoodMax
            30.0, // deepOkMax
            40.0, // deepLightnessBelow
            4.5   // paletteMatchMax
    );

    /** Rating from ΔE alone, before any cap or upgrade. */
    public ColorRating baseRating(double deltaE, Lab garment) {
        boolean deep = garment.l() < deepLightnessBelow;
        if (deltaE <= (deep ? deepGreatMax : greatMax)) return ColorRating.GREAT;
        if (deltaE <= (deep ? deepGoodMax : goodMax)) return ColorRating.GOOD;
        if (deltaE <= okMaxFor(garment)) return ColorRating.OK;
        return ColorRating.RISKY;
    }

    public double okMaxFor(Lab garment) {
        return garment.l() < deepLightnessBelow ? deepOkMax : okMax;
    }
}
