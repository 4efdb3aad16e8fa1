package com.flowmable.seasonal;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of classifying one garment color against the palette registry.
 * <p>
 * Season and group fields are null when the status is UNCLASSIFIED. Secondary fields are
 * only set for a crossover: a runner-up within reach that belongs to a different
 * parent season.
 *
 * @param dominantHex             The input hex, echoed unchanged
 * @param lab                     Lab of the input; null if the hex is malformed
 * @param microSeasonTag          Micro-season of the best match
 * @param seasonTag               Parent season of the best match
 * @param groupTag                Palette group of the best match
 * @param nearestPaletteColor     Closest palette color, kept as diagnostics even when unclassified
 * @param minDeltaE               ΔE to the closest palette color (global minimum)
 * @param secondaryMicroSeasonTag Micro-season of the crossover runner-up
 * @param secondarySeasonTag      Parent season of the crossover runner-up
 * @param secondaryGroupTag       Palette group of the crossover runner-up
 * @param secondaryDeltaE         ΔE to the crossover runner-up
 * @param classificationStatus    Confidence tier
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ClassificationResult(
        String dominantHex,
        Lab lab,
        MicroSeason microSeasonTag,
        ParentSeason seasonTag,
        ColorGroup groupTag,
        NearestColor nearestPaletteColor,
        Double minDeltaE,
        MicroSeason secondaryMicroSeasonTag,
        ParentSeason secondarySeasonTag,
        ColorGroup secondaryGroupTag,
        Double secondaryDeltaE,
        ClassificationStatus classificationStatus
) {
    /** Unclassified result with optional diagnostics (nearest color and its ΔE). */
    static ClassificationResult unclassified(String hex, Lab lab, NearestColor nearest, Double minDeltaE) {
        return new ClassificationResult(hex, lab,
                null, null, null,
                nearest, minDeltaE,
                null, null, null, null,
                ClassificationStatus.UNCLASSIFIED);
    }

    /** True if a secondary (different parent season) match was reported. */
    public boolean hasCrossover() {
        return secondarySeasonTag != null;
    }
}
