package com.flowmable.seasonal;

import java.util.List;
import java.util.Map;

/**
 * Personalized rating of one garment color for one user.
 * <p>
 * For {@link ColorRating#INSUFFICIENT_DATA} only {@code rating}, {@code ratingReason} and
 * {@code explanation} are set.
 *
 * @param rating             Final rating after caps and upgrades
 * @param baseRating         Rating from ΔE alone
 * @param deltaE             Smallest ΔE to any palette of the user's parent season
 * @param garmentAttributes  Undertone, depth and clarity of the garment
 * @param compatibility      Attribute comparison with the user
 * @param clarityContext     Clarity findings
 * @param capsApplied        Codes of the caps and upgrades that fired, in order
 * @param ratingReason       Technical trace of the rating
 * @param explanation        User-facing copy
 * @param closestColor       Palette color at {@code deltaE}
 * @param closestGroup       Group of {@code closestColor}
 * @param bestSubSeason      Micro-season of {@code closestColor}
 * @param userMicroSeason    The user's own micro-season
 * @param deltaEBySubSeason  Smallest ΔE per micro-season of the parent season
 */
public record ColorScore(
        ColorRating rating,
        ColorRating baseRating,
        Double deltaE,
        GarmentAttributes garmentAttributes,
        AttributeCompatibility compatibility,
        ClarityContext clarityContext,
        List<String> capsApplied,
        String ratingReason,
        ColorExplanation explanation,
        NearestColor closestColor,
        ColorGroup closestGroup,
        MicroSeason bestSubSeason,
        MicroSeason userMicroSeason,
        Map<MicroSeason, Double> deltaEBySubSeason
) {
    static ColorScore insufficientData(String summary, String detail) {
        return new ColorScore(ColorRating.INSUFFICIENT_DATA, null, null, null, null, null,
                List.of(), summary,
                new ColorExplanation(summary, List.of(ColorExplanation.plain(detail))),
                null, null, null, null, Map.of());
    }

    /** The "how to wear" line, or empty if the explanation has none. */
    public String stylingTip() {
        List<ColorExplanation.Bullet> bullets = explanation.bullets();
        return bullets.size() > 2 ? bullets.get(2).text() : "";
    }
}
