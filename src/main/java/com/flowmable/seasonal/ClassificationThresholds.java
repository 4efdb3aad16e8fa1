package com.flowmable.seasonal;

/**
 * Gating thresholds of {@link GarmentClassifier}, all in CIEDE2000 units.
 * <p>
 * The defaults are empirically tuned. Any modification requires a
 * CLASSIFICATION_MODEL_VERSION increment, since stored classifications change meaning.
 *
 * @param unclassifiedAbove Best match ΔE above this is too far from every palette
 * @param crossoverMax      Runner-up ΔE at or below this may be reported as a crossover
 * @param ambiguousGap      Runner-up gap below this is AMBIGUOUS
 * @param greatGap          Runner-up gap at or above this is GREAT (between the two: GOOD)
 */
public record ClassificationThresholds(
        double unclassifiedAbove,
        double crossoverMax,
        double ambiguousGap,
        double greatGap
) {
    public static final String CLASSIFICATION_MODEL_VERSION = "2.0";

    public static final ClassificationThresholds DEFAULT = new ClassificationThresholds(
            12.0, // unclassifiedAbove
            10.0, // crossoverMax
            2.0,  // ambiguousGap
            4.0   // greatGap
    );

    /**
     * Status tier for the gap between runner-up and best ΔE.
     * Pass {@link Double#POSITIVE_INFINITY} when there is no runner-up.
     */
    public ClassificationStatus statusForGap(double gap) {
        if (gap < ambiguousGap) {
            return ClassificationStatus.AMBIGUOUS;
        }
        if (gap < greatGap) {
            return ClassificationStatus.GOOD;
        }
        return ClassificationStatus.GREAT;
    }
}
