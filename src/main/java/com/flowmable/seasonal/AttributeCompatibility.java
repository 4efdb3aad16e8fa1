package com.flowmable.seasonal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scored comparison of a garment's attributes with a user's profile.
 * <p>
 * Priority is undertone, then clarity, then depth; the weights reflect that.
 *
 * @param score                Sum of the three component scores
 * @param undertoneScore       1 match, 0.8 olive on warm, 0.5 neutral, 0.3 allowed, -2 true conflict, -0.5 otherwise
 * @param clarityScore         1 match, 0 adjacent, -1.5 opposite
 * @param depthScore           0.5 match, 0.25 adjacent, -1 opposite
 * @param reasons              Reason codes, in evaluation order
 * @param hasUndertoneMismatch Undertone neither matching nor allowed
 * @param hasClarityMismatch   Muted against clear
 * @param hasTrueConflict      Warm against cool
 */
public record AttributeCompatibility(
        double score,
        double undertoneScore,
        double clarityScore,
        double depthScore,
        List<String> reasons,
        boolean hasUndertoneMismatch,
        boolean hasClarityMismatch,
        boolean hasTrueConflict
) {
    public AttributeCompatibility {
        reasons = List.copyOf(reasons);
    }

    /**
     * @param userDepth   nullable; absent depth is compared as medium
     * @param userClarity nullable; absent clarity is compared as medium
     */
    public static AttributeCompatibility evaluate(GarmentAttributes garment,
                                                  ParentSeason userSeason,
                                                  Depth userDepth,
                                                  Clarity userClarity) {
        Objects.requireNonNull(garment, "garment");
        Objects.requireNonNull(userSeason, "userSeason");

        List<String> reasons = new ArrayList<>(3);
        boolean undertoneMismatch = false;
        boolean clarityMismatch = false;
        boolean trueConflict = false;

        Undertone expected = userSeason.expectedUndertone();
        Undertone garmentUndertone = garment.undertone();

        double undertoneScore;
        if (garmentUndertone == expected) {
            undertoneScore = 1.0;
            reasons.add("undertone_match");
        } else if (garmentUndertone == Undertone.OLIVE && expected == Undertone.WARM) {
            undertoneScore = 0.8;
            reasons.add("undertone_olive_warm_compatible");
        } else if (garmentUndertone == Undertone.NEUTRAL) {
            undertoneScore = 0.5;
            reasons.add("undertone_neutral");
        } else if (isUndertoneAllowed(garmentUndertone, expected)) {
            undertoneScore = 0.3;
            reasons.add("undertone_compatible");
        } else if (isTrueUndertoneConflict(garmentUndertone, expected)) {
            undertoneScore = -2.0;
            undertoneMismatch = true;
            trueConflict = true;
            reasons.add("undertone_true_conflict");
        } else {
            undertoneScore = -0.5;
            undertoneMismatch = true;
            reasons.add("undertone_mismatch");
        }

        Clarity user = userClarity == null ? Clarity.MEDIUM : Clarity.normalize(userClarity);
        Clarity worn = garment.clarity();
        double clarityScore;
        if (worn == user) {
            clarityScore = 1.0;
            reasons.add("clarity_match");
        } else if (worn == Clarity.MEDIUM || user == Clarity.MEDIUM) {
            clarityScore = 0.0;
            reasons.add("clarity_adjacent");
        } else {
            clarityScore = -1.5;
            clarityMismatch = true;
            reasons.add("clarity_mismatch");
        }

        Depth userLevel = userDepth == null ? Depth.MEDIUM : userDepth;
        double depthScore;
        int steps = garment.depth().distanceTo(userLevel);
        if (steps == 0) {
            depthScore = 0.5;
            reasons.add("depth_match");
        } else if (steps == 1) {
            depthScore = 0.25;
            reasons.add("depth_adjacent");
        } else {
            depthScore = -1.0;
            reasons.add("depth_mismatch");
        }

        return new AttributeCompatibility(
                undertoneScore + clarityScore + depthScore,
                undertoneScore,
                clarityScore,
                depthScore,
                Collections.unmodifiableList(reasons),
                undertoneMismatch,
                clarityMismatch,
                trueConflict
        );
    }

    /**
     * Warm users may wear warm, neutral and olive; cool users cool and neutral;
     * neutral users anything.
     */
    public static boolean isUndertoneAllowed(Undertone garment, Undertone user) {
        if (user == null || user == Undertone.NEUTRAL || user == Undertone.OLIVE) {
            return true;
        }
        if (garment == Undertone.NEUTRAL || garment == user) {
            return true;
        }
        return user == Undertone.WARM && garment == Undertone.OLIVE;
    }

    /**
     * Only warm (or olive) against cool is a true conflict. Olive never conflicts with warm,
     * and neutral never conflicts with anything.
     */
    public static boolean isTrueUndertoneConflict(Undertone garment, Undertone user) {
        if (garment == Undertone.NEUTRAL || user == Undertone.NEUTRAL) {
            return false;
        }
        boolean garmentWarm = garment == Undertone.WARM || garment == Undertone.OLIVE;
        boolean garmentCool = garment == Undertone.COOL;
        return (garmentWarm && user == Undertone.COOL) || (garmentCool && user == Undertone.WARM);
    }
}
