package com.flowmable.seasonal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Classifies a garment color into the nearest micro-season palette group.
 * <p>
 * Scans every registry entry, takes the global CIEDE2000 minimum as the best match and the
 * closest entry from any other {@code (microSeason, group)} pair as the runner-up, then:
 * <ol>
 *   <li>Gate: best ΔE above {@code unclassifiedAbove} → UNCLASSIFIED (nearest kept).</li>
 *   <li>Crossover: runner-up within {@code crossoverMax} and from another parent season →
 *       secondary fields.</li>
 *   <li>Status from the runner-up gap: AMBIGUOUS / GOOD / GREAT.</li>
 * </ol>
 * Stateless and reentrant; the registry is immutable.
 */
public class GarmentClassifier {

    private static final Logger logger = LoggerFactory.getLogger(GarmentClassifier.class);

    private final PaletteRegistry registry;
    private final ClassificationThresholds thresholds;

    public GarmentClassifier() {
        this(PaletteRegistry.defaultRegistry());
    }

    public GarmentClassifier(PaletteRegistry registry) {
        this(registry, ClassificationThresholds.DEFAULT);
    }

    public GarmentClassifier(PaletteRegistry registry, ClassificationThresholds thresholds) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public ClassificationResult classifyGarment(String hex) {
        Lab inputLab = ColorSpaceUtils.hexToLab(hex);
        if (inputLab == null) {
            logger.debug("Unclassified '{}': not a hex color", hex);
            return ClassificationResult.unclassified(hex, null, null, null);
        }

        List<PaletteEntry> entries = registry.entries();
        if (entries.isEmpty()) {
            logger.warn("Unclassified '{}': palette registry is empty", hex);
            return ClassificationResult.unclassified(hex, inputLab, null, null);
        }

        double[] deltaEs = new double[entries.size()];
        int best = 0;
        for (int i = 0; i < deltaEs.length; i++) {
            deltaEs[i] = DeltaE2000.deltaE(inputLab, entries.get(i).color().lab());
            if (deltaEs[i] < deltaEs[best]) {
                best = i;
            }
        }
        PaletteEntry bestMatch = entries.get(best);
        double minDeltaE = deltaEs[best];

        // Runner-up must come from a different (microSeason, group) pair
        int runnerUp = -1;
        for (int i = 0; i < deltaEs.length; i++) {
            if (entries.get(i).sharesGroupWith(bestMatch)) {
                continue;
            }
            if (runnerUp < 0 || deltaEs[i] < deltaEs[runnerUp]) {
                runnerUp = i;
            }
        }

        NearestColor nearest = NearestColor.of(bestMatch.color());

        // Gate 1: too far from every palette color
        if (minDeltaE > thresholds.unclassifiedAbove()) {
            logger.debug("Unclassified '{}': nearest {} at ΔE {}", hex, nearest.name(), minDeltaE);
            return ClassificationResult.unclassified(hex, inputLab, nearest, minDeltaE);
        }

        ParentSeason primaryParent = bestMatch.microSeason().parent();

        MicroSeason secondaryMicroSeason = null;
        ParentSeason secondarySeason = null;
        ColorGroup secondaryGroup = null;
        Double secondaryDeltaE = null;
        if (runnerUp >= 0) {
            PaletteEntry runnerUpMatch = entries.get(runnerUp);
            ParentSeason runnerUpParent = runnerUpMatch.microSeason().parent();
            if (deltaEs[runnerUp] <= thresholds.crossoverMax() && runnerUpParent != primaryParent) {
                secondaryMicroSeason = runnerUpMatch.microSeason();
                secondarySeason = runnerUpParent;
                secondaryGroup = runnerUpMatch.group();
                secondaryDeltaE = deltaEs[runnerUp];
            }
        }

        double gap = runnerUp >= 0 ? deltaEs[runnerUp] - minDeltaE : Double.POSITIVE_INFINITY;
        ClassificationStatus status = thresholds.statusForGap(gap);

        if (logger.isDebugEnabled()) {
            logger.debug("Classified '{}' → {}/{} ({}) ΔE={} gap={} status={} crossover={}",
                    hex, bestMatch.microSeason().getTag(), bestMatch.group().getTag(), nearest.name(),
                    String.format("%.2f", minDeltaE), String.format("%.2f", gap), status.getTag(),
                    secondaryMicroSeason == null ? "-" : secondaryMicroSeason.getTag());
        }

        return new ClassificationResult(
                hex,
                inputLab,
                bestMatch.microSeason(),
                primaryParent,
                bestMatch.group(),
                nearest,
                minDeltaE,
                secondaryMicroSeason,
                secondarySeason,
                secondaryGroup,
                secondaryDeltaE,
                status
        );
    }

    public PaletteRegistry registry() {
        return registry;
    }

    public ClassificationThresholds thresholds() {
        return thresholds;
    }
}
